package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiKeyAuth(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"var_name"}) String varName,
    String location
) implements SourceAuth {

    public ApiKeyAuth {
        apiKey = Descriptors.requireText(apiKey, "api_key");
        varName = Descriptors.textOr(varName, "X-Api-Key");
        location = Descriptors.textOr(location, "header").toLowerCase(Locale.ROOT);
        if (!location.equals("header") && !location.equals("query") && !location.equals("cookie")) {
            throw new IllegalArgumentException("api_key location must be header, query or cookie");
        }
    }

    @Override
    public String toString() {
        return "ApiKeyAuth[varName=" + varName + ", location=" + location + "]";
    }
}
