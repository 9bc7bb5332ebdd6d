package io.toolbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.GraphQlSource;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.Payloads;
import io.toolbridge.transport.TransportErrors;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Exposes every field of the root type selected by {@code operation_type} as a tool. Discovery runs an
 * introspection query; a call sends a one-field operation with typed variables and returns that field's data.
 */
public final class GraphQlToolSourceClient implements ToolSourceClient {
    private static final MediaType JSON = MediaType.get("application/json");
    private static final String TYPE_REF = "kind name ofType { kind name ofType { kind name ofType { kind name } } }";
    static final String INTROSPECTION_QUERY = "query IntrospectionQuery { __schema { "
        + "queryType { name } mutationType { name } "
        + "types { kind name fields { name description "
        + "args { name description type { " + TYPE_REF + " } } "
        + "type { " + TYPE_REF + " } } } } }";

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpAuthenticator authenticator;

    public GraphQlToolSourceClient(OkHttpClient client, ObjectMapper mapper, HttpAuthenticator authenticator) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator must not be null");
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.GRAPHQL;
    }

    @Override
    public List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException {
        GraphQlSource graphQl = (GraphQlSource) source;
        JsonNode schema = post(graphQl, INTROSPECTION_QUERY, Map.of(), "Introspection of source " + source.name())
            .path("__schema");
        String rootName = schema.path(graphQl.operationType().equals("mutation") ? "mutationType" : "queryType")
            .path("name").asText("");
        if (rootName.isBlank()) {
            return List.of();
        }

        Map<String, JsonNode> types = new HashMap<>();
        for (JsonNode type : schema.path("types")) {
            types.put(type.path("name").asText(), type);
        }
        JsonNode root = types.get(rootName);
        if (root == null) {
            throw ToolSourceException.malformed("Introspection of source " + source.name() + " lacks root type " + rootName, null);
        }

        List<RawTool> tools = new ArrayList<>();
        for (JsonNode field : root.path("fields")) {
            Map<String, Object> properties = new LinkedHashMap<>();
            List<String> required = new ArrayList<>();
            Map<String, Object> variables = new LinkedHashMap<>();
            for (JsonNode arg : field.path("args")) {
                String argName = arg.path("name").asText();
                JsonNode type = arg.path("type");
                Map<String, Object> property = schemaOf(type);
                if (!arg.path("description").asText("").isBlank()) {
                    property.put("description", arg.path("description").asText());
                }
                properties.put(argName, property);
                variables.put(argName, typeString(type));
                if ("NON_NULL".equals(type.path("kind").asText())) {
                    required.add(argName);
                }
            }
            Map<String, Object> inputSchema = new LinkedHashMap<>();
            inputSchema.put("type", "object");
            inputSchema.put("properties", properties);
            if (!required.isEmpty()) {
                inputSchema.put("required", required);
            }

            Map<String, Object> callTemplate = new LinkedHashMap<>();
            callTemplate.put("operation", graphQl.operationType());
            callTemplate.put("field", field.path("name").asText());
            callTemplate.put("variables", variables);
            callTemplate.put("selection", selection(field.path("type"), types));

            tools.add(new RawTool(field.path("name").asText(), field.path("description").asText(""),
                inputSchema, null, callTemplate, source));
        }
        return tools;
    }

    @Override
    public Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException {
        GraphQlSource graphQl = (GraphQlSource) source;
        Map<String, Object> template = tool.callTemplate();
        String operation = template.get("operation") instanceof String op ? op : graphQl.operationType();
        String field = template.get("field") instanceof String name ? name : tool.rawName();
        String selection = template.get("selection") instanceof String text ? text : "";
        Map<?, ?> declared = template.get("variables") instanceof Map<?, ?> vars ? vars : Map.of();

        List<String> definitions = new ArrayList<>();
        List<String> bindings = new ArrayList<>();
        Map<String, Object> variables = new LinkedHashMap<>();
        for (Map.Entry<String, Object> argument : arguments.entrySet()) {
            Object declaredType = declared.get(argument.getKey());
            String type = declaredType == null ? inferType(argument.getValue()) : String.valueOf(declaredType);
            definitions.add("$" + argument.getKey() + ": " + type);
            bindings.add(argument.getKey() + ": $" + argument.getKey());
            variables.put(argument.getKey(), argument.getValue());
        }

        StringBuilder query = new StringBuilder(operation);
        if (!definitions.isEmpty()) {
            query.append(" (").append(String.join(", ", definitions)).append(')');
        }
        query.append(" { ").append(field);
        if (!bindings.isEmpty()) {
            query.append('(').append(String.join(", ", bindings)).append(')');
        }
        if (!selection.isBlank()) {
            query.append(' ').append(selection);
        }
        query.append(" }");

        JsonNode data = post(graphQl, query.toString(), variables, "Call to tool " + tool.rawName() + " on source " + source.name());
        return mapper.convertValue(data.path(field), Object.class);
    }

    private JsonNode post(GraphQlSource source, String query, Map<String, Object> variables, String context)
        throws ToolSourceException {
        HttpUrl parsed = HttpUrl.parse(source.url());
        if (parsed == null) {
            throw ToolSourceException.connection("Source " + source.name() + " has an invalid url: " + source.url(), null);
        }
        HttpUrl.Builder url = parsed.newBuilder();
        Request.Builder request = new Request.Builder();
        source.headers().forEach(request::header);
        authenticator.authorize(source.auth(), url, request);

        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query", query);
            payload.put("variables", variables);
            request.url(url.build()).post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
            try (Response response = client.newCall(request.build()).execute()) {
                String raw = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    throw ToolSourceException.remote(context + " answered HTTP " + response.code() + " " + Payloads.snippet(raw));
                }
                JsonNode body = mapper.readTree(raw);
                JsonNode errors = body.path("errors");
                if (errors.isArray() && !errors.isEmpty()) {
                    List<String> messages = new ArrayList<>();
                    errors.forEach(error -> messages.add(error.path("message").asText(error.toString())));
                    throw ToolSourceException.remote(context + " returned GraphQL errors: " + String.join("; ", messages));
                }
                return body.path("data");
            }
        } catch (IOException e) {
            throw TransportErrors.translate(context, e);
        }
    }

    private static Map<String, Object> schemaOf(JsonNode type) {
        String kind = type.path("kind").asText();
        Map<String, Object> schema = new LinkedHashMap<>();
        switch (kind) {
            case "NON_NULL" -> {
                return schemaOf(type.path("ofType"));
            }
            case "LIST" -> {
                schema.put("type", "array");
                schema.put("items", schemaOf(type.path("ofType")));
            }
            case "INPUT_OBJECT" -> schema.put("type", "object");
            case "SCALAR" -> schema.put("type", scalarType(type.path("name").asText()));
            default -> schema.put("type", "string");
        }
        return schema;
    }

    private static String scalarType(String name) {
        return switch (name) {
            case "Int" -> "integer";
            case "Float" -> "number";
            case "Boolean" -> "boolean";
            default -> "string";
        };
    }

    static String typeString(JsonNode type) {
        return switch (type.path("kind").asText()) {
            case "NON_NULL" -> typeString(type.path("ofType")) + "!";
            case "LIST" -> "[" + typeString(type.path("ofType")) + "]";
            default -> type.path("name").asText("String");
        };
    }

    private static String selection(JsonNode returnType, Map<String, JsonNode> types) {
        JsonNode named = returnType;
        while (named.path("kind").asText().equals("NON_NULL") || named.path("kind").asText().equals("LIST")) {
            named = named.path("ofType");
        }
        String kind = named.path("kind").asText();
        if (!kind.equals("OBJECT") && !kind.equals("INTERFACE")) {
            return "";
        }
        JsonNode type = types.get(named.path("name").asText());
        List<String> scalars = new ArrayList<>();
        if (type != null) {
            for (JsonNode field : type.path("fields")) {
                JsonNode fieldType = field.path("type");
                while (fieldType.path("kind").asText().equals("NON_NULL") || fieldType.path("kind").asText().equals("LIST")) {
                    fieldType = fieldType.path("ofType");
                }
                String fieldKind = fieldType.path("kind").asText();
                boolean hasArgs = field.path("args").isArray() && !field.path("args").isEmpty();
                if ((fieldKind.equals("SCALAR") || fieldKind.equals("ENUM")) && !hasArgs) {
                    scalars.add(field.path("name").asText());
                }
            }
        }
        return scalars.isEmpty() ? "{ __typename }" : "{ " + String.join(" ", scalars) + " }";
    }

    private static String inferType(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return "Int";
        }
        if (value instanceof Number) {
            return "Float";
        }
        if (value instanceof Boolean) {
            return "Boolean";
        }
        return "String";
    }
}
