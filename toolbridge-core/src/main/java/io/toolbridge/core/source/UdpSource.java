package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UdpSource(
    String name,
    String host,
    Integer port,
    @JsonAlias({"timeout_ms"}) Long timeoutMs,
    @JsonAlias({"buffer_size"}) Integer bufferSize
) implements SourceDescriptor {
    private static final int MAX_DATAGRAM = 65_507;

    public UdpSource {
        name = Descriptors.requireText(name, "name");
        host = Descriptors.requireText(host, "host");
        port = Descriptors.port(port);
        timeoutMs = Descriptors.timeout(timeoutMs);
        bufferSize = bufferSize == null ? MAX_DATAGRAM : bufferSize;
        if (bufferSize < 1 || bufferSize > MAX_DATAGRAM) {
            throw new IllegalArgumentException("buffer_size must be between 1 and " + MAX_DATAGRAM);
        }
    }

    public static UdpSource of(String name, String host, int port) {
        return new UdpSource(name, host, port, null, null);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.UDP;
    }
}
