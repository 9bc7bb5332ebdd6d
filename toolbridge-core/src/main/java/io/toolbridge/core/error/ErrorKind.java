package io.toolbridge.core.error;

public enum ErrorKind {
    SOURCE_UNREACHABLE,
    SCHEMA_DEGRADED,
    TOOL_NOT_FOUND,
    INVOCATION_FAILED,
    LIFECYCLE_ERROR
}
