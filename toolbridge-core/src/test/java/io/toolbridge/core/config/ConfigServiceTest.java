package io.toolbridge.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.toolbridge.core.source.ApiKeyAuth;
import io.toolbridge.core.source.CliSource;
import io.toolbridge.core.source.GraphQlSource;
import io.toolbridge.core.source.HttpSource;
import io.toolbridge.core.source.McpSource;
import io.toolbridge.core.source.OAuth2Auth;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.source.SseSource;
import io.toolbridge.core.source.StreamableHttpSource;
import io.toolbridge.core.source.TcpSource;
import io.toolbridge.core.source.TextSource;
import io.toolbridge.core.source.UdpSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {
    @TempDir
    Path tempDir;

    private final ConfigService service = new ConfigService(Map.of("PETSTORE_KEY", "secret-123", "TOKEN_HOST", "auth.local"));

    @Test
    void loadsEveryProtocolKind() throws Exception {
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, """
            {
              "manual_call_templates": [
                {"name": "petstore", "call_template_type": "http", "url": "http://localhost:8080/openapi.json",
                 "http_method": "get", "auth": {"auth_type": "api_key", "api_key": "${PETSTORE_KEY}", "var_name": "api_key"}},
                {"name": "ticker", "call_template_type": "sse", "url": "http://localhost/events", "event_type": "tool"},
                {"name": "stream", "call_template_type": "streamable_http", "url": "http://localhost/stream",
                 "http_method": "POST", "body_field": "body", "header_fields": ["X-Trace"]},
                {"name": "shell", "call_template_type": "cli", "command": "my-tool --manual", "timeout_ms": 5000},
                {"name": "countries", "call_template_type": "graphql", "url": "http://localhost/graphql",
                 "operation_type": "mutation",
                 "auth": {"auth_type": "oauth2", "token_url": "https://${TOKEN_HOST}/token", "client_id": "app"}},
                {"name": "files", "call_template_type": "mcp", "command": "npx", "args": ["-y", "server-files"],
                 "env": {"ROOT": "/tmp"}},
                {"name": "tcp", "call_template_type": "tcp", "host": "localhost", "port": 9000},
                {"name": "udp", "call_template_type": "udp", "host": "localhost", "port": 9001, "buffer_size": 4096},
                {"name": "notes", "call_template_type": "text", "file_path": "/tmp/notes.json"}
              ]
            }
            """);

        AdapterConfig loaded = service.load(config);

        assertThat(loaded.failOnSessionError()).isFalse();
        assertThat(loaded.sources()).extracting(SourceDescriptor::kind).containsExactly(
            ProtocolKind.HTTP, ProtocolKind.SSE, ProtocolKind.STREAMABLE_HTTP, ProtocolKind.CLI, ProtocolKind.GRAPHQL,
            ProtocolKind.MCP, ProtocolKind.TCP, ProtocolKind.UDP, ProtocolKind.TEXT);

        HttpSource petstore = (HttpSource) loaded.sources().get(0);
        assertThat(petstore.httpMethod()).isEqualTo("GET");
        assertThat(petstore.contentType()).isEqualTo("application/json");
        assertThat(petstore.auth()).isEqualTo(new ApiKeyAuth("secret-123", "api_key", "header"));

        assertThat(((SseSource) loaded.sources().get(1)).eventType()).isEqualTo("tool");
        StreamableHttpSource stream = (StreamableHttpSource) loaded.sources().get(2);
        assertThat(stream.bodyField()).isEqualTo("body");
        assertThat(stream.headerFields()).containsExactly("X-Trace");
        assertThat(((CliSource) loaded.sources().get(3)).timeoutMs()).isEqualTo(5000L);

        GraphQlSource countries = (GraphQlSource) loaded.sources().get(4);
        assertThat(countries.operationType()).isEqualTo("mutation");
        assertThat(((OAuth2Auth) countries.auth()).tokenUrl()).isEqualTo("https://auth.local/token");

        McpSource files = (McpSource) loaded.sources().get(5);
        assertThat(files.stdio()).isTrue();
        assertThat(files.args()).containsExactly("-y", "server-files");
        assertThat(files.env()).containsEntry("ROOT", "/tmp");
        assertThat(((TcpSource) loaded.sources().get(6)).port()).isEqualTo(9000);
        assertThat(((UdpSource) loaded.sources().get(7)).bufferSize()).isEqualTo(4096);
        assertThat(((TextSource) loaded.sources().get(8)).filePath()).isEqualTo("/tmp/notes.json");
    }

    @Test
    void missingFileYieldsEmptyConfig() throws Exception {
        AdapterConfig loaded = service.load(tempDir.resolve("absent.json"));

        assertThat(loaded.sources()).isEmpty();
    }

    @Test
    void skipsUnsupportedTemplateTypes() {
        AdapterConfig config = service.parse(Map.of(
            "manual_call_templates", List.of(
                Map.of("name", "mail", "call_template_type", "smtp", "host", "localhost"),
                Map.of("name", "notes", "call_template_type", "TEXT", "file_path", "/tmp/notes.json")),
            "fail_on_session_error", true));

        assertThat(config.sources()).singleElement().isEqualTo(new TextSource("notes", "/tmp/notes.json"));
        assertThat(config.failOnSessionError()).isTrue();
    }

    @Test
    void keepsUnresolvedPlaceholders() {
        AdapterConfig config = service.parse(Map.of("manual_call_templates", List.of(
            Map.of("name", "api", "call_template_type", "http", "url", "http://${UNKNOWN_HOST}/manual"))));

        assertThat(((HttpSource) config.sources().get(0)).url()).isEqualTo("http://${UNKNOWN_HOST}/manual");
    }

    @Test
    void invalidTemplateNamesTheEntry() {
        assertThatThrownBy(() -> service.parse(Map.of("manual_call_templates", List.of(
            Map.of("name", "tcp", "call_template_type", "tcp", "host", "localhost", "port", 70000)))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("#0")
            .hasMessageContaining("tcp");

        assertThatThrownBy(() -> service.parse(Map.of("manual_call_templates", List.of(
            Map.of("name", "mcp", "call_template_type", "mcp")))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("command or url");
    }

    @Test
    void rejectsNonArrayTemplates() {
        assertThatThrownBy(() -> service.parse(Map.of("manual_call_templates", "http://localhost")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("manual_call_templates");
    }

    @Test
    void secretsAreMaskedInToString() {
        AdapterConfig config = service.parse(Map.of("manual_call_templates", List.of(Map.of(
            "name", "petstore", "call_template_type", "http", "url", "http://localhost",
            "auth", Map.of("auth_type", "api_key", "api_key", "${PETSTORE_KEY}")))));

        assertThat(config.sources().get(0).toString()).doesNotContain("secret-123");
    }

    @Test
    void resolvesHomeRelativePaths() {
        String home = System.getProperty("user.home");

        assertThat(ConfigPaths.resolve("~/tools.json")).isEqualTo(Path.of(home, "tools.json"));
        assertThat(ConfigPaths.resolve(" ")).isEqualTo(ConfigPaths.defaultConfigPath());
        assertThat(ConfigPaths.resolve("/etc/toolbridge.json")).isEqualTo(Path.of("/etc/toolbridge.json"));
    }
}
