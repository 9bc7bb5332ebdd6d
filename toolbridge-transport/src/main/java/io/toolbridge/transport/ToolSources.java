package io.toolbridge.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.spi.ToolSourceRegistry;
import io.toolbridge.transport.cli.CliToolSourceClient;
import io.toolbridge.transport.http.GraphQlToolSourceClient;
import io.toolbridge.transport.http.HttpAuthenticator;
import io.toolbridge.transport.http.HttpToolSourceClient;
import io.toolbridge.transport.http.SseToolSourceClient;
import io.toolbridge.transport.http.StreamableHttpToolSourceClient;
import io.toolbridge.transport.mcp.McpToolSourceClient;
import io.toolbridge.transport.socket.TcpToolSourceClient;
import io.toolbridge.transport.socket.UdpToolSourceClient;
import io.toolbridge.transport.text.TextToolSourceClient;
import java.time.Duration;
import okhttp3.OkHttpClient;

/**
 * Registry with a client for every protocol kind.
 */
public final class ToolSources {

    private ToolSources() {
    }

    public static ToolSourceRegistry defaults() {
        return defaults(new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(30)).build(), new ObjectMapper());
    }

    public static ToolSourceRegistry defaults(OkHttpClient client, ObjectMapper mapper) {
        HttpAuthenticator authenticator = new HttpAuthenticator(client, mapper);
        return new ToolSourceRegistry()
            .register(new HttpToolSourceClient(client, mapper, authenticator))
            .register(new SseToolSourceClient(client, mapper, authenticator))
            .register(new StreamableHttpToolSourceClient(client, mapper, authenticator))
            .register(new GraphQlToolSourceClient(client, mapper, authenticator))
            .register(new CliToolSourceClient(mapper))
            .register(new McpToolSourceClient(client, mapper))
            .register(new TcpToolSourceClient(mapper))
            .register(new UdpToolSourceClient(mapper))
            .register(new TextToolSourceClient(mapper));
    }
}
