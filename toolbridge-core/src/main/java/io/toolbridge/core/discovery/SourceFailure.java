package io.toolbridge.core.discovery;

import io.toolbridge.core.error.ErrorKind;
import io.toolbridge.core.source.SourceDescriptor;
import java.util.Objects;

public record SourceFailure(SourceDescriptor source, ErrorKind kind, String message) {
    public SourceFailure {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
    }

    public String sourceName() {
        return source.name();
    }
}
