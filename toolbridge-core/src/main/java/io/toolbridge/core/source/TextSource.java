package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TextSource(
    String name,
    @JsonAlias({"file_path"}) String filePath
) implements SourceDescriptor {

    public TextSource {
        name = Descriptors.requireText(name, "name");
        filePath = Descriptors.requireText(filePath, "file_path");
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.TEXT;
    }
}
