package io.toolbridge.core.spi;

import io.toolbridge.core.error.InvocationFailure;
import java.util.Objects;

/**
 * Raised by {@link ToolSourceClient} implementations. The adapter translates it into the unified error
 * taxonomy, so clients only need to pick the closest {@link InvocationFailure}.
 */
public class ToolSourceException extends Exception {
    private final InvocationFailure failure;

    public ToolSourceException(InvocationFailure failure, String message) {
        this(failure, message, null);
    }

    public ToolSourceException(InvocationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure must not be null");
    }

    public static ToolSourceException timeout(String message, Throwable cause) {
        return new ToolSourceException(InvocationFailure.TIMEOUT, message, cause);
    }

    public static ToolSourceException connection(String message, Throwable cause) {
        return new ToolSourceException(InvocationFailure.CONNECTION, message, cause);
    }

    public static ToolSourceException malformed(String message, Throwable cause) {
        return new ToolSourceException(InvocationFailure.MALFORMED_RESPONSE, message, cause);
    }

    public static ToolSourceException remote(String message) {
        return new ToolSourceException(InvocationFailure.REMOTE_ERROR, message, null);
    }

    public InvocationFailure failure() {
        return failure;
    }
}
