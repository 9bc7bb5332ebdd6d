package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphQlSource(
    String name,
    String url,
    SourceAuth auth,
    Map<String, String> headers,
    @JsonAlias({"operation_type"}) String operationType
) implements SourceDescriptor {

    public GraphQlSource {
        name = Descriptors.requireText(name, "name");
        url = Descriptors.requireText(url, "url");
        headers = Descriptors.copy(headers);
        operationType = Descriptors.textOr(operationType, "query").toLowerCase(Locale.ROOT);
        if (!operationType.equals("query") && !operationType.equals("mutation")) {
            throw new IllegalArgumentException("operation_type must be query or mutation");
        }
    }

    public static GraphQlSource of(String name, String url) {
        return new GraphQlSource(name, url, null, null, null);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.GRAPHQL;
    }
}
