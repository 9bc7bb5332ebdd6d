package io.toolbridge.transport;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.error.InvocationFailure;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PayloadsTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldDecodeJsonAndKeepPlainText() {
        assertThat(Payloads.decode("{\"ok\": true}", mapper)).isEqualTo(Map.of("ok", true));
        assertThat(Payloads.decode(" [1, 2] \n", mapper)).isEqualTo(List.of(1, 2));
        assertThat(Payloads.decode("\"quoted\"", mapper)).isEqualTo("quoted");
        assertThat(Payloads.decode("42 apples\n", mapper)).isEqualTo("42 apples");
        assertThat(Payloads.decode("{broken", mapper)).isEqualTo("{broken");
        assertThat(Payloads.decode("   ", mapper)).isEqualTo("");
    }

    @Test
    void shouldTruncateLongSnippets() {
        assertThat(Payloads.snippet("x".repeat(400))).hasSize(303).endsWith("...");
        assertThat(Payloads.snippet(null)).isEmpty();
    }

    @Test
    void shouldClassifyIoFailures() {
        assertThat(TransportErrors.translate("call", new SocketTimeoutException("read timed out")).failure())
            .isEqualTo(InvocationFailure.TIMEOUT);
        assertThat(TransportErrors.translate("call", new IOException("reset")).failure())
            .isEqualTo(InvocationFailure.CONNECTION);
        assertThat(TransportErrors.translate("call", new IOException()).getMessage()).isEqualTo("call: IOException");
    }
}
