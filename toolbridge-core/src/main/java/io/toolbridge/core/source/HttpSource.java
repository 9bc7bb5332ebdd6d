package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpSource(
    String name,
    String url,
    @JsonAlias({"http_method"}) String httpMethod,
    @JsonAlias({"content_type"}) String contentType,
    SourceAuth auth,
    Map<String, String> headers,
    @JsonAlias({"body_field"}) String bodyField,
    @JsonAlias({"header_fields"}) List<String> headerFields
) implements SourceDescriptor, HttpEndpoint {

    public HttpSource {
        name = Descriptors.requireText(name, "name");
        url = Descriptors.requireText(url, "url");
        httpMethod = Descriptors.method(httpMethod);
        contentType = Descriptors.textOr(contentType, "application/json");
        headers = Descriptors.copy(headers);
        headerFields = Descriptors.copy(headerFields);
    }

    public static HttpSource of(String name, String url) {
        return new HttpSource(name, url, null, null, null, null, null, null);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.HTTP;
    }
}
