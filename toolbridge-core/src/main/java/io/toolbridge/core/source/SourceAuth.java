package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "auth_type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ApiKeyAuth.class, name = "api_key"),
    @JsonSubTypes.Type(value = BasicAuth.class, name = "basic"),
    @JsonSubTypes.Type(value = OAuth2Auth.class, name = "oauth2")
})
public sealed interface SourceAuth permits ApiKeyAuth, BasicAuth, OAuth2Auth {
}
