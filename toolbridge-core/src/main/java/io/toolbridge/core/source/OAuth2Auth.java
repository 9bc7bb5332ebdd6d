package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * OAuth2 client-credentials grant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuth2Auth(
    @JsonAlias({"token_url"}) String tokenUrl,
    @JsonAlias({"client_id"}) String clientId,
    @JsonAlias({"client_secret"}) String clientSecret,
    String scope
) implements SourceAuth {

    public OAuth2Auth {
        tokenUrl = Descriptors.requireText(tokenUrl, "token_url");
        clientId = Descriptors.requireText(clientId, "client_id");
        clientSecret = clientSecret == null ? "" : clientSecret;
        scope = Descriptors.textOr(scope, null);
    }

    @Override
    public String toString() {
        return "OAuth2Auth[tokenUrl=" + tokenUrl + ", clientId=" + clientId + "]";
    }
}
