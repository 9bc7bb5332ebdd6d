package io.toolbridge.transport.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.error.InvocationFailure;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.ApiKeyAuth;
import io.toolbridge.core.source.BasicAuth;
import io.toolbridge.core.source.HttpSource;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceException;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpToolSourceClientTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private HttpToolSourceClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient http = new OkHttpClient.Builder().readTimeout(Duration.ofSeconds(2)).build();
        client = new HttpToolSourceClient(http, mapper, new HttpAuthenticator(http, mapper));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldDiscoverToolsFromManual() throws Exception {
        server.enqueue(json("""
            {
              "tools": [
                {"name": "get_weather_forecast", "description": "Five day forecast",
                 "inputs": {"type": "object", "properties": {"city": {"type": "string"}}, "required": ["city"]},
                 "tool_call_template": {"url": "%s/forecast/{city}", "http_method": "GET"}},
                {"name": "get_air_quality", "description": "AQI"}
              ]
            }
            """.formatted(server.url("/api").toString())));
        HttpSource source = HttpSource.of("weather", server.url("/manual").toString());

        List<RawTool> tools = client.discover(source, ToolSession.stateless(source));

        assertThat(tools).extracting(RawTool::rawName).containsExactly("get_weather_forecast", "get_air_quality");
        assertThat(tools.get(0).description()).isEqualTo("Five day forecast");
        assertThat(tools.get(0).inputSchema()).isInstanceOf(Map.class);
        assertThat(tools.get(0).callTemplate()).containsEntry("http_method", "GET");
        assertThat(tools.get(1).source()).isEqualTo(source);
        assertThat(server.takeRequest().getMethod()).isEqualTo("GET");
    }

    @Test
    void shouldMapArgumentsOntoPathQueryAndHeaders() throws Exception {
        server.enqueue(json("{\"city\": \"Harare\", \"days\": [\"sunny\"]}"));
        HttpSource source = new HttpSource("weather", server.url("/manual").toString(), null, null,
            new ApiKeyAuth("k-123", "X-Api-Key", "header"), Map.of("X-Client", "toolbridge"), null, List.of("X-Trace"));
        RawTool tool = new RawTool("get_weather_forecast", "", null, null,
            Map.of("url", template("/forecast/{city}")), source);
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("city", "Port Louis");
        arguments.put("units", "metric");
        arguments.put("fields", List.of("temp", "wind"));
        arguments.put("X-Trace", "trace-1");

        Object result = client.invoke(source, ToolSession.stateless(source), tool, arguments);

        assertThat(result).isEqualTo(Map.of("city", "Harare", "days", List.of("sunny")));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/forecast/Port%20Louis?units=metric&fields=temp&fields=wind");
        assertThat(request.getHeader("X-Api-Key")).isEqualTo("k-123");
        assertThat(request.getHeader("X-Client")).isEqualTo("toolbridge");
        assertThat(request.getHeader("X-Trace")).isEqualTo("trace-1");
    }

    @Test
    void shouldSendJsonBodyForPost() throws Exception {
        server.enqueue(json("{\"id\": 7}"));
        HttpSource source = new HttpSource("petstore", server.url("/pets").toString(), "POST", null,
            new BasicAuth("admin", "s3cret"), null, null, null);
        RawTool tool = RawTool.of("add_pet", "", null, source);

        Object result = client.invoke(source, ToolSession.stateless(source), tool, Map.of("name", "Rex"));

        assertThat(result).isEqualTo(Map.of("id", 7));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Basic YWRtaW46czNjcmV0");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(mapper.readTree(request.getBody().readUtf8())).isEqualTo(mapper.readTree("{\"name\":\"Rex\"}"));
    }

    @Test
    void shouldSendBodyFieldAndRemainingArgumentsAsQuery() throws Exception {
        server.enqueue(new MockResponse().setBody("stored"));
        HttpSource source = new HttpSource("docs", server.url("/docs").toString(), "PUT", "text/plain",
            new ApiKeyAuth("q-1", "key", "query"), null, "content", null);
        RawTool tool = RawTool.of("store", "", null, source);
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("content", "hello world");
        arguments.put("version", 2);

        Object result = client.invoke(source, ToolSession.stateless(source), tool, arguments);

        assertThat(result).isEqualTo("stored");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/docs?version=2&key=q-1");
        assertThat(request.getBody().readUtf8()).isEqualTo("hello world");
    }

    @Test
    void shouldEncodeFormBodies() throws Exception {
        server.enqueue(json("{}"));
        HttpSource source = new HttpSource("forms", server.url("/submit").toString(), "post",
            "application/x-www-form-urlencoded", null, null, null, null);

        client.invoke(source, ToolSession.stateless(source), RawTool.of("submit", "", null, source),
            Map.of("user", "ann lee"));

        assertThat(server.takeRequest().getBody().readUtf8()).isEqualTo("user=ann%20lee");
    }

    @Test
    void shouldReportHttpErrorsAsRemoteFailures() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));
        HttpSource source = HttpSource.of("weather", server.url("/forecast").toString());

        assertThatThrownBy(() -> client.invoke(source, ToolSession.stateless(source),
            RawTool.of("forecast", "", null, source), Map.of()))
            .isInstanceOfSatisfying(ToolSourceException.class, e -> {
                assertThat(e.failure()).isEqualTo(InvocationFailure.REMOTE_ERROR);
                assertThat(e.getMessage()).contains("503", "maintenance");
            });
    }

    @Test
    void shouldReportMissingPathParameter() {
        HttpSource source = HttpSource.of("weather", template("/forecast/{city}"));

        assertThatThrownBy(() -> client.invoke(source, ToolSession.stateless(source),
            RawTool.of("forecast", "", null, source), Map.of()))
            .isInstanceOf(ToolSourceException.class)
            .hasMessageContaining("city");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldReportTimeouts() {
        server.enqueue(json("{}").setBodyDelay(5, TimeUnit.SECONDS));
        HttpSource source = HttpSource.of("slow", server.url("/slow").toString());

        assertThatThrownBy(() -> client.invoke(source, ToolSession.stateless(source),
            RawTool.of("slow", "", null, source), Map.of()))
            .isInstanceOfSatisfying(ToolSourceException.class,
                e -> assertThat(e.failure()).isEqualTo(InvocationFailure.TIMEOUT));
    }

    @Test
    void shouldRejectManualWithoutTools() {
        server.enqueue(json("{\"openapi\": \"3.0.0\"}"));
        HttpSource source = HttpSource.of("weather", server.url("/manual").toString());

        assertThatThrownBy(() -> client.discover(source, ToolSession.stateless(source)))
            .isInstanceOfSatisfying(ToolSourceException.class,
                e -> assertThat(e.failure()).isEqualTo(InvocationFailure.MALFORMED_RESPONSE));
    }

    @Test
    void shouldReportUnreachableSource() {
        HttpSource source = HttpSource.of("gone", "http://127.0.0.1:1/manual");

        assertThatThrownBy(() -> client.discover(source, ToolSession.stateless(source)))
            .isInstanceOfSatisfying(ToolSourceException.class,
                e -> assertThat(e.failure()).isEqualTo(InvocationFailure.CONNECTION));
    }

    // server.url() would percent-encode the braces
    private String template(String path) {
        return "http://" + server.getHostName() + ":" + server.getPort() + path;
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
