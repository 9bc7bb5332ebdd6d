package io.toolbridge.core.spi;

import io.toolbridge.core.source.SourceDescriptor;

/**
 * Handle on the live state a client keeps for one source: a spawned process, an open socket, a negotiated
 * protocol session. Clients without persistent state use {@link #stateless(SourceDescriptor)}.
 */
public interface ToolSession {
    SourceDescriptor source();

    static ToolSession stateless(SourceDescriptor source) {
        return new StatelessToolSession(source);
    }
}
