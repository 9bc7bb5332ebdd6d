package io.toolbridge.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites a source-reported input schema into the strict JSON Schema subset hosts accept.
 *
 * <p>Never throws: anything it cannot convert becomes {@code {}} (or an empty object schema at the top level)
 * and is reported as a warning. A schema that only uses supported constructs comes back equal to its input.
 */
public final class SchemaNormalizer {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> WRAPPER_KEYS = Set.of("json", "schema", "inputSchema", "input_schema");
    private static final Set<String> STANDARD_TYPES = Set.of("string", "number", "integer", "boolean", "object", "array");
    private static final Set<String> SCHEMA_MAP_KEYWORDS = Set.of("$defs", "definitions", "patternProperties");
    private static final Set<String> SCHEMA_LIST_KEYWORDS = Set.of("allOf");
    private static final Map<String, String> TYPE_ALIASES = typeAliases();

    public NormalizedSchema normalize(Object rawSchema) {
        List<String> warnings = new ArrayList<>();
        Map<String, Object> schema;
        try {
            schema = topLevel(unwrap(toPlain(rawSchema, warnings)), warnings);
        } catch (RuntimeException e) {
            warnings.add("schema could not be normalized (" + e.getMessage() + "), using an empty object schema");
            schema = emptyObject();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> frozen = (Map<String, Object>) freeze(schema);
        return new NormalizedSchema(frozen, warnings);
    }

    private Map<String, Object> topLevel(Object node, List<String> warnings) {
        if (node == null || Boolean.TRUE.equals(node)) {
            return emptyObject();
        }
        if (!(node instanceof Map<?, ?> map)) {
            warnings.add("top-level schema is a " + node.getClass().getSimpleName() + ", not an object schema");
            return emptyObject();
        }
        if (map.isEmpty()) {
            return emptyObject();
        }
        Map<String, Object> normalized = normalizeMap(map, "$", warnings);
        Object type = normalized.get("type");
        if (type == null) {
            Map<String, Object> typed = new LinkedHashMap<>();
            typed.put("type", "object");
            typed.putAll(normalized);
            return typed;
        }
        if (!"object".equals(type)) {
            warnings.add("top-level schema has type " + type + ", expected object");
            return emptyObject();
        }
        return normalized;
    }

    private Object normalizeNode(Object node, String path, List<String> warnings) {
        if (Boolean.TRUE.equals(node)) {
            return new LinkedHashMap<String, Object>();
        }
        if (node instanceof Map<?, ?> map) {
            return normalizeMap(map, path, warnings);
        }
        if (Boolean.FALSE.equals(node)) {
            warnings.add(path + ": schema false rejects every value, widened to {} which accepts any value");
            return new LinkedHashMap<String, Object>();
        }
        warnings.add(path + ": unsupported schema node " + describe(node) + " replaced by {}");
        return new LinkedHashMap<String, Object>();
    }

    private Map<String, Object> normalizeMap(Map<?, ?> input, String path, List<String> warnings) {
        Object unwrapped = unwrap(input);
        if (!(unwrapped instanceof Map<?, ?> source)) {
            return new LinkedHashMap<>();
        }

        Map<String, Object> out = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();
        Set<String> nullableProperties = new LinkedHashSet<>();
        Map<String, Object> inlined = null;

        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "type" -> {
                    Object type = normalizeType(value, path, notes, warnings);
                    if (type != null) {
                        out.put(key, type);
                    }
                }
                case "properties" -> {
                    if (value instanceof Map<?, ?> properties) {
                        Map<String, Object> normalized = new LinkedHashMap<>();
                        for (Map.Entry<?, ?> property : properties.entrySet()) {
                            String name = String.valueOf(property.getKey());
                            if (isNullable(property.getValue())) {
                                nullableProperties.add(name);
                            }
                            normalized.put(name, normalizeNode(property.getValue(), path + ".properties." + name, warnings));
                        }
                        out.put(key, normalized);
                    } else {
                        warnings.add(path + ": properties is not an object, dropped");
                    }
                }
                case "required" -> {
                    if (value instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
                        out.put(key, new ArrayList<>(list));
                    } else {
                        warnings.add(path + ": required is not a list of names, dropped");
                    }
                }
                case "items" -> {
                    if (value instanceof List<?> tuple) {
                        List<Object> normalized = new ArrayList<>();
                        for (int i = 0; i < tuple.size(); i++) {
                            normalized.add(normalizeNode(tuple.get(i), path + ".items[" + i + "]", warnings));
                        }
                        out.put(key, normalized);
                    } else {
                        out.put(key, normalizeNode(value, path + ".items", warnings));
                    }
                }
                case "additionalProperties" -> {
                    if (value instanceof Boolean) {
                        out.put(key, value);
                    } else {
                        out.put(key, normalizeNode(value, path + ".additionalProperties", warnings));
                    }
                }
                case "not" -> out.put(key, normalizeNode(value, path + ".not", warnings));
                case "anyOf", "oneOf" -> {
                    if (!(value instanceof List<?> branches)) {
                        warnings.add(path + ": " + key + " is not a list, dropped");
                        break;
                    }
                    List<Object> concrete = new ArrayList<>();
                    for (int i = 0; i < branches.size(); i++) {
                        Object branch = branches.get(i);
                        if (!isNullBranch(branch)) {
                            concrete.add(normalizeNode(branch, path + "." + key + "[" + i + "]", warnings));
                        }
                    }
                    if (concrete.size() == branches.size() || concrete.size() > 1) {
                        out.put(key, concrete);
                    } else if (concrete.size() == 1) {
                        @SuppressWarnings("unchecked")
                        Map<String, Object> single = (Map<String, Object>) concrete.get(0);
                        inlined = single;
                    } else {
                        warnings.add(path + ": " + key + " only allows null, using string");
                        out.putIfAbsent("type", "string");
                    }
                }
                default -> {
                    if (SCHEMA_MAP_KEYWORDS.contains(key) && value instanceof Map<?, ?> schemas) {
                        Map<String, Object> normalized = new LinkedHashMap<>();
                        for (Map.Entry<?, ?> schema : schemas.entrySet()) {
                            String name = String.valueOf(schema.getKey());
                            normalized.put(name, normalizeNode(schema.getValue(), path + "." + key + "." + name, warnings));
                        }
                        out.put(key, normalized);
                    } else if (SCHEMA_LIST_KEYWORDS.contains(key) && value instanceof List<?> schemas) {
                        List<Object> normalized = new ArrayList<>();
                        for (int i = 0; i < schemas.size(); i++) {
                            normalized.add(normalizeNode(schemas.get(i), path + "." + key + "[" + i + "]", warnings));
                        }
                        out.put(key, normalized);
                    } else {
                        out.put(key, copy(value));
                    }
                }
            }
        }

        if (inlined != null) {
            for (Map.Entry<String, Object> entry : inlined.entrySet()) {
                if (entry.getKey().equals("description") && out.containsKey("description")) {
                    continue;
                }
                out.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        dropNullableFromRequired(out, nullableProperties);
        appendNotes(out, notes);
        return out;
    }

    private Object normalizeType(Object type, String path, List<String> notes, List<String> warnings) {
        if (type instanceof String name) {
            if (name.equals("null")) {
                warnings.add(path + ": type null has no concrete counterpart, using string");
                return "string";
            }
            return mapType(name, path, notes, warnings);
        }
        if (type instanceof List<?> union) {
            Set<String> mapped = new LinkedHashSet<>();
            for (Object member : union) {
                if (!(member instanceof String name)) {
                    warnings.add(path + ": non-string type member " + describe(member) + " dropped");
                } else if (!name.equals("null")) {
                    mapped.add(mapType(name, path, notes, warnings));
                }
            }
            if (mapped.isEmpty()) {
                warnings.add(path + ": type union only allows null, using string");
                return "string";
            }
            if (mapped.size() == 1) {
                return mapped.iterator().next();
            }
            return new ArrayList<>(mapped);
        }
        warnings.add(path + ": type " + describe(type) + " is not a type name, dropped");
        return null;
    }

    private String mapType(String name, String path, List<String> notes, List<String> warnings) {
        if (STANDARD_TYPES.contains(name)) {
            return name;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (STANDARD_TYPES.contains(lower)) {
            return lower;
        }
        String alias = TYPE_ALIASES.get(lower);
        notes.add("(original type: " + name + ")");
        if (alias != null) {
            return alias;
        }
        warnings.add(path + ": unknown type '" + name + "' mapped to string");
        return "string";
    }

    private static void dropNullableFromRequired(Map<String, Object> out, Set<String> nullableProperties) {
        if (nullableProperties.isEmpty() || !(out.get("required") instanceof List<?> required)) {
            return;
        }
        List<Object> kept = new ArrayList<>(required);
        kept.removeIf(nullableProperties::contains);
        if (kept.size() == required.size()) {
            return;
        }
        if (kept.isEmpty()) {
            out.remove("required");
        } else {
            out.put("required", kept);
        }
    }

    private static void appendNotes(Map<String, Object> out, List<String> notes) {
        if (notes.isEmpty()) {
            return;
        }
        String joined = String.join(" ", new LinkedHashSet<>(notes));
        Object description = out.get("description");
        if (description instanceof String text && !text.isBlank()) {
            out.put("description", text + " " + joined);
        } else {
            out.put("description", joined);
        }
    }

    private static boolean isNullable(Object schema) {
        if (!(schema instanceof Map<?, ?> map)) {
            return false;
        }
        Object type = map.get("type");
        if (type instanceof List<?> union && union.contains("null") && union.size() > 1) {
            return true;
        }
        for (String key : List.of("anyOf", "oneOf")) {
            if (map.get(key) instanceof List<?> branches && branches.size() > 1
                && branches.stream().anyMatch(SchemaNormalizer::isNullBranch)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNullBranch(Object branch) {
        return branch instanceof Map<?, ?> map && "null".equals(map.get("type"));
    }

    private static Object unwrap(Object node) {
        Object current = node;
        while (current instanceof Map<?, ?> map && map.size() == 1) {
            Map.Entry<?, ?> only = map.entrySet().iterator().next();
            if (!WRAPPER_KEYS.contains(String.valueOf(only.getKey())) || !(only.getValue() instanceof Map<?, ?>)) {
                break;
            }
            current = only.getValue();
        }
        return current;
    }

    private static Object toPlain(Object raw, List<String> warnings) {
        if (raw instanceof JsonNode node) {
            return node.isNull() || node.isMissingNode() ? null : MAPPER.convertValue(node, Object.class);
        }
        if (raw instanceof String text) {
            try {
                return MAPPER.readValue(text, Object.class);
            } catch (JsonProcessingException e) {
                warnings.add("schema text is not valid JSON: " + e.getOriginalMessage());
                return null;
            }
        }
        return raw;
    }

    private static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(copy(v)));
            return copy;
        }
        return value;
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> frozen = new LinkedHashMap<>();
            map.forEach((k, v) -> frozen.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(frozen);
        }
        if (value instanceof List<?> list) {
            List<Object> frozen = new ArrayList<>(list.size());
            list.forEach(v -> frozen.add(freeze(v)));
            return Collections.unmodifiableList(frozen);
        }
        return value;
    }

    private static Map<String, Object> emptyObject() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", new LinkedHashMap<String, Object>());
        return schema;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + "(" + value + ")";
    }

    private static Map<String, String> typeAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (String name : List.of("file", "binary", "bytes", "date", "datetime", "date-time", "uri", "str", "text")) {
            aliases.put(name, "string");
        }
        for (String name : List.of("int", "long", "int32", "int64")) {
            aliases.put(name, "integer");
        }
        for (String name : List.of("float", "double", "decimal")) {
            aliases.put(name, "number");
        }
        aliases.put("bool", "boolean");
        aliases.put("dict", "object");
        aliases.put("map", "object");
        aliases.put("list", "array");
        aliases.put("tuple", "array");
        return Map.copyOf(aliases);
    }
}
