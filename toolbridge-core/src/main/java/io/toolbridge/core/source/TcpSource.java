package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TcpSource(
    String name,
    String host,
    Integer port,
    @JsonAlias({"timeout_ms"}) Long timeoutMs
) implements SourceDescriptor {

    public TcpSource {
        name = Descriptors.requireText(name, "name");
        host = Descriptors.requireText(host, "host");
        port = Descriptors.port(port);
        timeoutMs = Descriptors.timeout(timeoutMs);
    }

    public static TcpSource of(String name, String host, int port) {
        return new TcpSource(name, host, port, null);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.TCP;
    }
}
