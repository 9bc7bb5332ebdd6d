package io.toolbridge.core.error;

/**
 * Transport-neutral reason behind an {@link ErrorKind#INVOCATION_FAILED} error.
 */
public enum InvocationFailure {
    TIMEOUT,
    CONNECTION,
    MALFORMED_RESPONSE,
    REMOTE_ERROR,
    UNKNOWN
}
