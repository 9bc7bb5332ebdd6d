package io.toolbridge.core.spi;

import io.toolbridge.core.source.SourceDescriptor;
import java.util.Objects;

final class StatelessToolSession implements ToolSession {
    private final SourceDescriptor source;

    StatelessToolSession(SourceDescriptor source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public SourceDescriptor source() {
        return source;
    }

    @Override
    public String toString() {
        return "StatelessToolSession[" + source.name() + "]";
    }
}
