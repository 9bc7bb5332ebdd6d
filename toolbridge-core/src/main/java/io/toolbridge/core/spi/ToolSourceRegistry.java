package io.toolbridge.core.spi;

import io.toolbridge.core.source.ProtocolKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class ToolSourceRegistry {
    private final Map<ProtocolKind, ToolSourceClient> clients = new EnumMap<>(ProtocolKind.class);

    public synchronized ToolSourceRegistry register(ToolSourceClient client) {
        Objects.requireNonNull(client, "client must not be null");
        clients.put(client.kind(), client);
        return this;
    }

    public synchronized Optional<ToolSourceClient> find(ProtocolKind kind) {
        return Optional.ofNullable(clients.get(kind));
    }

    public synchronized List<ToolSourceClient> all() {
        return List.copyOf(new ArrayList<>(clients.values()));
    }
}
