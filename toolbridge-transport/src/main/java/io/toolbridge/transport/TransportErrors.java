package io.toolbridge.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.toolbridge.core.spi.ToolSourceException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

/**
 * Maps I/O failures onto {@link io.toolbridge.core.error.InvocationFailure} tags.
 */
public final class TransportErrors {

    private TransportErrors() {
    }

    public static ToolSourceException translate(String context, IOException e) {
        String message = context + ": " + describe(e);
        if (e instanceof SocketTimeoutException || e instanceof InterruptedIOException) {
            return ToolSourceException.timeout(message, e);
        }
        if (e instanceof JsonProcessingException) {
            return ToolSourceException.malformed(message, e);
        }
        return ToolSourceException.connection(message, e);
    }

    public static ToolSourceException interrupted(String context, InterruptedException e) {
        Thread.currentThread().interrupt();
        return ToolSourceException.timeout(context + ": interrupted", e);
    }

    private static String describe(Throwable e) {
        String message = e instanceof JsonProcessingException json ? json.getOriginalMessage() : e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
