package io.toolbridge.transport.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.error.InvocationFailure;
import io.toolbridge.core.source.ApiKeyAuth;
import io.toolbridge.core.source.OAuth2Auth;
import io.toolbridge.core.spi.ToolSourceException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpAuthenticatorTest {
    private MockWebServer server;
    private MutableClock clock;
    private HttpAuthenticator authenticator;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        authenticator = new HttpAuthenticator(new OkHttpClient(), new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldFetchAndCacheClientCredentialsToken() throws Exception {
        server.enqueue(token("tok-1", 120));
        server.enqueue(token("tok-2", 120));
        OAuth2Auth auth = new OAuth2Auth(server.url("/oauth/token").toString(), "app", "shh", "tools.read");

        assertThat(authorization(auth)).isEqualTo("Bearer tok-1");
        clock.advance(Duration.ofSeconds(60));
        assertThat(authorization(auth)).isEqualTo("Bearer tok-1");
        assertThat(server.getRequestCount()).isEqualTo(1);

        RecordedRequest tokenRequest = server.takeRequest();
        assertThat(tokenRequest.getMethod()).isEqualTo("POST");
        assertThat(tokenRequest.getBody().readUtf8())
            .contains("grant_type=client_credentials", "client_id=app", "client_secret=shh", "scope=tools.read");
    }

    @Test
    void shouldRefreshTokenShortlyBeforeExpiry() throws Exception {
        server.enqueue(token("tok-1", 120));
        server.enqueue(token("tok-2", 120));
        OAuth2Auth auth = new OAuth2Auth(server.url("/oauth/token").toString(), "app", "shh", null);

        authorization(auth);
        clock.advance(Duration.ofSeconds(95));

        assertThat(authorization(auth)).isEqualTo("Bearer tok-2");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldFailWhenTokenEndpointRejectsClient() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid_client\"}"));
        OAuth2Auth auth = new OAuth2Auth(server.url("/oauth/token").toString(), "app", "wrong", null);

        assertThatThrownBy(() -> authorization(auth))
            .isInstanceOfSatisfying(ToolSourceException.class, e -> {
                assertThat(e.failure()).isEqualTo(InvocationFailure.REMOTE_ERROR);
                assertThat(e.getMessage()).contains("401");
            });
    }

    @Test
    void shouldPlaceApiKeyInCookie() throws Exception {
        HttpUrl.Builder url = HttpUrl.get("http://localhost/tools").newBuilder();
        Request.Builder request = new Request.Builder();

        authenticator.authorize(new ApiKeyAuth("c-9", "session", "cookie"), url, request);

        assertThat(request.url(url.build()).build().header("Cookie")).isEqualTo("session=c-9");
    }

    private String authorization(OAuth2Auth auth) throws ToolSourceException {
        HttpUrl.Builder url = HttpUrl.get("http://localhost/tools").newBuilder();
        Request.Builder request = new Request.Builder();
        authenticator.authorize(auth, url, request);
        return request.url(url.build()).build().header("Authorization");
    }

    private static MockResponse token(String value, long expiresIn) {
        return new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"access_token\":\"" + value + "\",\"token_type\":\"bearer\",\"expires_in\":" + expiresIn + "}");
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
