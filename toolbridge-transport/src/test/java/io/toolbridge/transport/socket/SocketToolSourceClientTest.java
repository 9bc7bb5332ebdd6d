package io.toolbridge.transport.socket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.error.InvocationFailure;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.TcpSource;
import io.toolbridge.core.source.UdpSource;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SocketToolSourceClientTest {
    private static final String MANUAL = "{\"tools\":[{\"name\":\"add\",\"description\":\"Adds two numbers\"},{\"name\":\"fail\"}]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private ServerSocket tcpServer;
    private DatagramSocket udpServer;

    @AfterEach
    void tearDown() throws IOException {
        if (tcpServer != null) {
            tcpServer.close();
        }
        if (udpServer != null) {
            udpServer.close();
        }
    }

    @Test
    void shouldDiscoverAndCallOverTcp() throws Exception {
        startTcpServer();
        TcpSource source = TcpSource.of("calc", "127.0.0.1", tcpServer.getLocalPort());
        TcpToolSourceClient client = new TcpToolSourceClient(mapper);

        List<RawTool> tools = client.discover(source, ToolSession.stateless(source));
        Object sum = client.invoke(source, ToolSession.stateless(source), tools.get(0), Map.of("a", 2, "b", 3));

        assertThat(tools).extracting(RawTool::rawName).containsExactly("add", "fail");
        assertThat(sum).isEqualTo(5);
    }

    @Test
    void shouldReportTcpErrorReplies() throws Exception {
        startTcpServer();
        TcpSource source = TcpSource.of("calc", "127.0.0.1", tcpServer.getLocalPort());
        TcpToolSourceClient client = new TcpToolSourceClient(mapper);

        assertThatThrownBy(() -> client.invoke(source, ToolSession.stateless(source), RawTool.of("fail", "", null, source), Map.of()))
            .isInstanceOfSatisfying(ToolSourceException.class, e -> {
                assertThat(e.failure()).isEqualTo(InvocationFailure.REMOTE_ERROR);
                assertThat(e.getMessage()).contains("division by zero");
            });
    }

    @Test
    void shouldReportRefusedTcpConnection() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        TcpSource source = TcpSource.of("gone", "127.0.0.1", port);

        assertThatThrownBy(() -> new TcpToolSourceClient(mapper).discover(source, ToolSession.stateless(source)))
            .isInstanceOfSatisfying(ToolSourceException.class,
                e -> assertThat(e.failure()).isEqualTo(InvocationFailure.CONNECTION));
    }

    @Test
    void shouldDiscoverAndCallOverUdp() throws Exception {
        startUdpServer();
        UdpSource source = UdpSource.of("calc", "127.0.0.1", udpServer.getLocalPort());
        UdpToolSourceClient client = new UdpToolSourceClient(mapper);

        List<RawTool> tools = client.discover(source, ToolSession.stateless(source));
        Object sum = client.invoke(source, ToolSession.stateless(source), tools.get(0), Map.of("a", 40, "b", 2));

        assertThat(tools).extracting(RawTool::rawName).containsExactly("add", "fail");
        assertThat(sum).isEqualTo(42);
    }

    @Test
    void shouldTimeOutWhenUdpPeerIsSilent() throws Exception {
        udpServer = new DatagramSocket(0, InetAddress.getLoopbackAddress());
        UdpSource source = new UdpSource("mute", "127.0.0.1", udpServer.getLocalPort(), 200L, null);

        assertThatThrownBy(() -> new UdpToolSourceClient(mapper).discover(source, ToolSession.stateless(source)))
            .isInstanceOfSatisfying(ToolSourceException.class,
                e -> assertThat(e.failure()).isEqualTo(InvocationFailure.TIMEOUT));
    }

    private String answer(String request) throws IOException {
        JsonNode message = mapper.readTree(request);
        if ("manual".equals(message.path("type").asText())) {
            return MANUAL;
        }
        if ("fail".equals(message.path("tool").asText())) {
            return "{\"error\":{\"message\":\"division by zero\"}}";
        }
        JsonNode arguments = message.path("arguments");
        return "{\"result\":" + (arguments.path("a").asInt() + arguments.path("b").asInt()) + "}";
    }

    private void startTcpServer() throws IOException {
        tcpServer = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        Thread thread = new Thread(() -> {
            while (!tcpServer.isClosed()) {
                try (Socket socket = tcpServer.accept()) {
                    BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                    OutputStream out = socket.getOutputStream();
                    out.write((answer(reader.readLine()) + "\n").getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (SocketException closed) {
                    return;
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            }
        }, "tcp-test-server");
        thread.setDaemon(true);
        thread.start();
    }

    private void startUdpServer() throws IOException {
        udpServer = new DatagramSocket(0, InetAddress.getLoopbackAddress());
        Thread thread = new Thread(() -> {
            byte[] buffer = new byte[4096];
            while (!udpServer.isClosed()) {
                try {
                    DatagramPacket request = new DatagramPacket(buffer, buffer.length);
                    udpServer.receive(request);
                    byte[] reply = answer(new String(request.getData(), 0, request.getLength(), StandardCharsets.UTF_8))
                        .getBytes(StandardCharsets.UTF_8);
                    udpServer.send(new DatagramPacket(reply, reply.length, request.getSocketAddress()));
                } catch (SocketException closed) {
                    return;
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            }
        }, "udp-test-server");
        thread.setDaemon(true);
        thread.start();
    }
}
