package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BasicAuth(String username, String password) implements SourceAuth {

    public BasicAuth {
        username = Descriptors.requireText(username, "username");
        password = password == null ? "" : password;
    }

    @Override
    public String toString() {
        return "BasicAuth[username=" + username + "]";
    }
}
