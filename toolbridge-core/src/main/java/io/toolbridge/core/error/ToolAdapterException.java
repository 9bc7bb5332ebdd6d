package io.toolbridge.core.error;

import java.util.Objects;

/**
 * The only error type that leaves the adapter. Callers branch on {@link #kind()} and, for invocation
 * failures, on {@link #failure()}; the protocol-specific cause is kept as message text and cause chain only.
 */
public final class ToolAdapterException extends RuntimeException {
    private final ErrorKind kind;
    private final InvocationFailure failure;

    public ToolAdapterException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public ToolAdapterException(ErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public ToolAdapterException(ErrorKind kind, InvocationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.failure = kind == ErrorKind.INVOCATION_FAILED && failure == null ? InvocationFailure.UNKNOWN : failure;
    }

    public static ToolAdapterException toolNotFound(String name) {
        return new ToolAdapterException(ErrorKind.TOOL_NOT_FOUND, "Unknown tool: " + name);
    }

    public static ToolAdapterException invocationFailed(InvocationFailure failure, String message, Throwable cause) {
        return new ToolAdapterException(ErrorKind.INVOCATION_FAILED, failure, message, cause);
    }

    public static ToolAdapterException lifecycle(String message, Throwable cause) {
        return new ToolAdapterException(ErrorKind.LIFECYCLE_ERROR, message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the failure detail for {@link ErrorKind#INVOCATION_FAILED}, {@code null} for every other kind
     */
    public InvocationFailure failure() {
        return failure;
    }

    public boolean timedOut() {
        return failure == InvocationFailure.TIMEOUT;
    }
}
