package io.toolbridge.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code {"manual_call_templates": [...], "fail_on_session_error": false}} into an {@link AdapterConfig}.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);
    private static final String TEMPLATES_FIELD = "manual_call_templates";
    private static final String TYPE_FIELD = "call_template_type";
    private static final String STRICT_FIELD = "fail_on_session_error";

    private final ObjectMapper mapper;
    private final VariableResolver variables;

    public ConfigService() {
        this(VariableResolver.environment());
    }

    public ConfigService(Map<String, String> variables) {
        this(VariableResolver.of(variables));
    }

    private ConfigService(VariableResolver variables) {
        this.mapper = new ObjectMapper();
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.variables = variables;
    }

    public AdapterConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            LOG.debug("No config at {}, starting without tool sources", configPath);
            return AdapterConfig.empty();
        }
        return parse(mapper.readTree(Files.readString(configPath)));
    }

    public AdapterConfig parse(Map<String, ?> config) {
        JsonNode tree = mapper.valueToTree(config);
        return parse(tree);
    }

    public AdapterConfig parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return AdapterConfig.empty();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Config root must be a JSON object");
        }
        JsonNode templates = root.path(TEMPLATES_FIELD);
        if (!templates.isMissingNode() && !templates.isNull() && !templates.isArray()) {
            throw new IllegalArgumentException(TEMPLATES_FIELD + " must be an array");
        }

        List<SourceDescriptor> sources = new ArrayList<>();
        for (int i = 0; i < templates.size(); i++) {
            parseTemplate(i, templates.get(i)).ifPresent(sources::add);
        }
        return new AdapterConfig(sources, root.path(STRICT_FIELD).asBoolean(false));
    }

    public SourceDescriptor parseTemplate(JsonNode template) {
        return parseTemplate(0, template)
            .orElseThrow(() -> new IllegalArgumentException("Unsupported " + TYPE_FIELD + ": " + template.path(TYPE_FIELD).asText()));
    }

    private Optional<SourceDescriptor> parseTemplate(int index, JsonNode template) {
        if (template == null || !template.isObject()) {
            throw new IllegalArgumentException("Call template #" + index + " must be a JSON object");
        }
        String type = template.path(TYPE_FIELD).asText("");
        Optional<ProtocolKind> kind = ProtocolKind.fromWireName(type);
        if (kind.isEmpty()) {
            LOG.warn("Skipping call template #{} ({}): unsupported {} '{}'",
                index, template.path("name").asText("unnamed"), TYPE_FIELD, type);
            return Optional.empty();
        }
        ObjectNode resolved = (ObjectNode) variables.resolve(template);
        resolved.put(TYPE_FIELD, kind.get().wireName());
        try {
            return Optional.of(mapper.treeToValue(resolved, SourceDescriptor.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid call template #" + index + " ("
                + template.path("name").asText("unnamed") + "): " + e.getOriginalMessage(), e);
        }
    }
}
