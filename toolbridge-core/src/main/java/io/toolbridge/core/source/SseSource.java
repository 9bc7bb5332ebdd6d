package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SseSource(
    String name,
    String url,
    @JsonAlias({"http_method"}) String httpMethod,
    @JsonAlias({"content_type"}) String contentType,
    SourceAuth auth,
    Map<String, String> headers,
    @JsonAlias({"body_field"}) String bodyField,
    @JsonAlias({"header_fields"}) List<String> headerFields,
    @JsonAlias({"event_type"}) String eventType
) implements SourceDescriptor, HttpEndpoint {

    public SseSource {
        name = Descriptors.requireText(name, "name");
        url = Descriptors.requireText(url, "url");
        httpMethod = Descriptors.method(httpMethod);
        contentType = Descriptors.textOr(contentType, "application/json");
        headers = Descriptors.copy(headers);
        headerFields = Descriptors.copy(headerFields);
        eventType = Descriptors.textOr(eventType, null);
    }

    public static SseSource of(String name, String url) {
        return new SseSource(name, url, null, null, null, null, null, null, null);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.SSE;
    }
}
