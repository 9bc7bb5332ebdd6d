package io.toolbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.source.ApiKeyAuth;
import io.toolbridge.core.source.BasicAuth;
import io.toolbridge.core.source.OAuth2Auth;
import io.toolbridge.core.source.SourceAuth;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.Payloads;
import io.toolbridge.transport.TransportErrors;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a source's {@link SourceAuth} to an outgoing request. OAuth2 client-credentials tokens are cached per
 * token endpoint and client until shortly before they expire.
 */
public final class HttpAuthenticator {
    private static final Logger LOG = LoggerFactory.getLogger(HttpAuthenticator.class);
    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(30);
    private static final Duration DEFAULT_TOKEN_LIFETIME = Duration.ofHours(1);

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<String, CachedToken> tokens = new ConcurrentHashMap<>();

    public HttpAuthenticator(OkHttpClient client, ObjectMapper mapper) {
        this(client, mapper, Clock.systemUTC());
    }

    public HttpAuthenticator(OkHttpClient client, ObjectMapper mapper, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void authorize(SourceAuth auth, HttpUrl.Builder url, Request.Builder request) throws ToolSourceException {
        if (auth == null) {
            return;
        }
        if (auth instanceof ApiKeyAuth apiKey) {
            switch (apiKey.location()) {
                case "query" -> url.setQueryParameter(apiKey.varName(), apiKey.apiKey());
                case "cookie" -> request.addHeader("Cookie", apiKey.varName() + "=" + apiKey.apiKey());
                default -> request.header(apiKey.varName(), apiKey.apiKey());
            }
        } else if (auth instanceof BasicAuth basic) {
            request.header("Authorization", Credentials.basic(basic.username(), basic.password()));
        } else if (auth instanceof OAuth2Auth oauth) {
            request.header("Authorization", "Bearer " + token(oauth));
        }
    }

    private String token(OAuth2Auth oauth) throws ToolSourceException {
        String key = oauth.tokenUrl() + "|" + oauth.clientId() + "|" + Objects.toString(oauth.scope(), "");
        CachedToken cached = tokens.get(key);
        Instant now = clock.instant();
        if (cached != null && now.plus(EXPIRY_MARGIN).isBefore(cached.expiresAt())) {
            return cached.value();
        }
        CachedToken fresh = fetchToken(oauth, now);
        tokens.put(key, fresh);
        return fresh.value();
    }

    private CachedToken fetchToken(OAuth2Auth oauth, Instant now) throws ToolSourceException {
        HttpUrl tokenUrl = HttpUrl.parse(oauth.tokenUrl());
        if (tokenUrl == null) {
            throw ToolSourceException.connection("Invalid OAuth2 token_url: " + oauth.tokenUrl(), null);
        }
        FormBody.Builder form = new FormBody.Builder()
            .add("grant_type", "client_credentials")
            .add("client_id", oauth.clientId())
            .add("client_secret", oauth.clientSecret());
        if (oauth.scope() != null) {
            form.add("scope", oauth.scope());
        }
        Request request = new Request.Builder().url(tokenUrl).post(form.build()).build();

        try (Response response = client.newCall(request).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw ToolSourceException.remote("OAuth2 token request to " + tokenUrl + " failed with HTTP "
                    + response.code() + " " + Payloads.snippet(raw));
            }
            JsonNode body = mapper.readTree(raw);
            String accessToken = body.path("access_token").asText("");
            if (accessToken.isBlank()) {
                throw ToolSourceException.malformed("OAuth2 token response from " + tokenUrl + " has no access_token", null);
            }
            long expiresIn = body.path("expires_in").asLong(DEFAULT_TOKEN_LIFETIME.toSeconds());
            LOG.debug("Fetched OAuth2 token for client {} (expires in {}s)", oauth.clientId(), expiresIn);
            return new CachedToken(accessToken, now.plusSeconds(expiresIn));
        } catch (IOException e) {
            throw TransportErrors.translate("OAuth2 token request to " + tokenUrl, e);
        }
    }

    private record CachedToken(String value, Instant expiresAt) {
    }
}
