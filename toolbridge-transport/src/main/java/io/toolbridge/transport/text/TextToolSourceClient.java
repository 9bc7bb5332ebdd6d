package io.toolbridge.transport.text;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.source.TextSource;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.manual.ManualParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A static manual on disk. Its tools have no remote behaviour: a call returns the file content.
 */
public final class TextToolSourceClient implements ToolSourceClient {
    private final ManualParser manualParser;

    public TextToolSourceClient(ObjectMapper mapper) {
        this.manualParser = new ManualParser(mapper);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.TEXT;
    }

    @Override
    public List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException {
        return manualParser.parse(read((TextSource) source), source);
    }

    @Override
    public Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException {
        return read((TextSource) source);
    }

    private static String read(TextSource source) throws ToolSourceException {
        Path path = Path.of(source.filePath());
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw ToolSourceException.connection("Cannot read " + path + " for source " + source.name() + ": " + e.getMessage(), e);
        }
    }
}
