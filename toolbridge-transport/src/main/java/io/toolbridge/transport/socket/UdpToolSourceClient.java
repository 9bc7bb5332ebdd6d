package io.toolbridge.transport.socket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.source.UdpSource;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.TransportErrors;
import io.toolbridge.transport.manual.ManualParser;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One datagram out, one datagram back. Replies larger than {@code buffer_size} are truncated by the socket.
 */
public final class UdpToolSourceClient implements ToolSourceClient {
    private final SocketProtocol protocol;
    private final ManualParser manualParser;

    public UdpToolSourceClient(ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        this.protocol = new SocketProtocol(mapper);
        this.manualParser = new ManualParser(mapper);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.UDP;
    }

    @Override
    public List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException {
        return manualParser.parse(exchange((UdpSource) source, protocol.manualRequest()), source);
    }

    @Override
    public Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException {
        UdpSource udp = (UdpSource) source;
        return protocol.readReply(exchange(udp, protocol.callRequest(tool, arguments)), source, tool);
    }

    private String exchange(UdpSource source, String request) throws ToolSourceException {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, source.timeoutMs()));
            byte[] payload = request.getBytes(StandardCharsets.UTF_8);
            InetAddress address = InetAddress.getByName(source.host());
            socket.send(new DatagramPacket(payload, payload.length, address, source.port()));

            byte[] buffer = new byte[source.bufferSize()];
            DatagramPacket reply = new DatagramPacket(buffer, buffer.length);
            socket.receive(reply);
            return new String(reply.getData(), reply.getOffset(), reply.getLength(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw TransportErrors.translate("UDP exchange with " + source.host() + ":" + source.port(), e);
        }
    }
}
