package io.toolbridge.core.spi;

import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import java.util.List;
import java.util.Map;

/**
 * Protocol-specific discovery and invocation for one {@link ProtocolKind}.
 *
 * <p>Implementations own their timeout policy and report a timeout as
 * {@link io.toolbridge.core.error.InvocationFailure#TIMEOUT}. Results are plain values
 * (maps, lists, strings, numbers) so the adapter can hand them to the host unchanged.
 */
public interface ToolSourceClient {
    ProtocolKind kind();

    default boolean requiresSession() {
        return false;
    }

    default ToolSession openSession(SourceDescriptor source) throws ToolSourceException {
        return ToolSession.stateless(source);
    }

    default void closeSession(ToolSession session) throws ToolSourceException {
    }

    List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException;

    Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException;
}
