package io.toolbridge.transport.socket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.source.TcpSource;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.TransportErrors;
import io.toolbridge.transport.manual.ManualParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One connection per exchange: a request line out, a reply line back.
 */
public final class TcpToolSourceClient implements ToolSourceClient {
    private final SocketProtocol protocol;
    private final ManualParser manualParser;

    public TcpToolSourceClient(ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        this.protocol = new SocketProtocol(mapper);
        this.manualParser = new ManualParser(mapper);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.TCP;
    }

    @Override
    public List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException {
        TcpSource tcp = (TcpSource) source;
        String reply = exchange(tcp, protocol.manualRequest());
        if (reply == null) {
            throw ToolSourceException.connection("Source " + source.name() + " closed the connection without a manual", null);
        }
        return manualParser.parse(reply, source);
    }

    @Override
    public Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException {
        TcpSource tcp = (TcpSource) source;
        return protocol.readReply(exchange(tcp, protocol.callRequest(tool, arguments)), source, tool);
    }

    private String exchange(TcpSource source, String request) throws ToolSourceException {
        int timeout = (int) Math.min(Integer.MAX_VALUE, source.timeoutMs());
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(source.host(), source.port()), timeout);
            socket.setSoTimeout(timeout);
            OutputStream out = socket.getOutputStream();
            out.write((request + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
            BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            return reader.readLine();
        } catch (IOException e) {
            throw TransportErrors.translate("TCP exchange with " + source.host() + ":" + source.port(), e);
        }
    }
}
