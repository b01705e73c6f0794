package ai.mcpagent.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.model.chat.request.json.JsonAnyOfSchema;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNullSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Converts between JSON Schema documents as MCP servers advertise them and LangChain4j's {@link JsonSchemaElement}
 * value types.
 *
 * <p>Incoming schemas are normalized first: a missing {@code type} on the root becomes {@code object}, a missing
 * {@code properties} becomes empty, {@code $schema}/{@code $id}/{@code $ref}/{@code definitions}/{@code $defs} are
 * dropped, and {@code const} becomes a one-value {@code enum}. Elements without a type (and with nothing that implies
 * one) accept any scalar or object value.
 */
public final class JsonSchemas {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Set<String> STRIPPED_KEYS = Set.of("$schema", "$id", "$ref", "definitions", "$defs");

    private JsonSchemas() {}

    /** Thrown when a schema cannot be represented. Callers usually skip the offending tool. */
    public static class UnsupportedSchemaException extends IllegalArgumentException {
        public UnsupportedSchemaException(String message) {
            super(message);
        }
    }

    /** Normalizes and converts a tool's input schema. */
    public static JsonObjectSchema objectSchemaFromJson(@Nullable JsonNode schema) {
        if (schema == null || schema.isNull() || schema.isMissingNode()) {
            return JsonObjectSchema.builder().build();
        }
        if (!schema.isObject()) {
            throw new UnsupportedSchemaException("Input schema must be a JSON object but was " + schema.getNodeType());
        }
        var normalized = normalize((ObjectNode) schema, true);
        var element = fromJson(normalized);
        if (element instanceof JsonObjectSchema obj) {
            return obj;
        }
        throw new UnsupportedSchemaException("Input schema must describe an object but was "
                + normalized.path("type").asText("?"));
    }

    /** Returns a cleaned copy; the argument is not modified. */
    public static ObjectNode normalize(ObjectNode schema, boolean root) {
        var copy = schema.deepCopy();
        STRIPPED_KEYS.forEach(copy::remove);

        if (copy.has("const")) {
            var values = NODES.arrayNode().add(copy.get("const"));
            copy.remove("const");
            copy.set("enum", values);
        }
        if (root && !copy.has("type") && !copy.has("anyOf") && !copy.has("oneOf")) {
            copy.put("type", "object");
        }
        if ("object".equals(primaryType(copy)) && !copy.has("properties")) {
            copy.set("properties", NODES.objectNode());
        }

        var properties = copy.get("properties");
        if (properties instanceof ObjectNode props) {
            var names = new ArrayList<String>();
            props.fieldNames().forEachRemaining(names::add);
            for (var name : names) {
                if (props.get(name) instanceof ObjectNode child) {
                    props.set(name, normalize(child, false));
                }
            }
        }
        if (copy.get("items") instanceof ObjectNode items) {
            copy.set("items", normalize(items, false));
        }
        for (var key : List.of("anyOf", "oneOf", "allOf")) {
            if (copy.get(key) instanceof ArrayNode alternatives) {
                var replaced = NODES.arrayNode();
                for (var alt : alternatives) {
                    replaced.add(alt instanceof ObjectNode o ? normalize(o, false) : alt);
                }
                copy.set(key, replaced);
            }
        }
        return copy;
    }

    private static @Nullable String primaryType(JsonNode schema) {
        var type = schema.get("type");
        if (type == null) {
            return schema.has("properties") ? "object" : null;
        }
        if (type.isTextual()) {
            return type.asText();
        }
        if (type.isArray()) {
            // ["string", "null"] style: take the first concrete type
            for (var t : type) {
                if (t.isTextual() && !"null".equals(t.asText())) {
                    return t.asText();
                }
            }
            return "null";
        }
        return null;
    }

    /** Converts an already normalized schema element. */
    public static JsonSchemaElement fromJson(JsonNode schema) {
        var description = schema.hasNonNull("description") ? schema.get("description").asText() : null;

        for (var key : List.of("anyOf", "oneOf")) {
            if (schema.get(key) instanceof ArrayNode alternatives) {
                var elements = new ArrayList<JsonSchemaElement>();
                for (var alt : alternatives) {
                    elements.add(fromJson(alt));
                }
                return JsonAnyOfSchema.builder()
                        .description(description)
                        .anyOf(elements)
                        .build();
            }
        }
        if (schema.get("allOf") instanceof ArrayNode parts && parts.size() == 1) {
            return fromJson(parts.get(0));
        }

        if (schema.get("enum") instanceof ArrayNode values) {
            var enumValues = new ArrayList<String>();
            values.forEach(v -> enumValues.add(v.asText()));
            return JsonEnumSchema.builder()
                    .description(description)
                    .enumValues(enumValues)
                    .build();
        }

        var type = primaryType(schema);
        if (type == null) {
            return anyValue(description);
        }
        return switch (type) {
            case "object" -> {
                var properties = new LinkedHashMap<String, JsonSchemaElement>();
                var props = schema.get("properties");
                if (props != null && props.isObject()) {
                    props.fields().forEachRemaining(e -> properties.put(e.getKey(), fromJson(e.getValue())));
                }
                var required = new ArrayList<String>();
                var req = schema.get("required");
                if (req != null && req.isArray()) {
                    req.forEach(r -> required.add(r.asText()));
                }
                var builder = JsonObjectSchema.builder()
                        .description(description)
                        .addProperties(properties)
                        .required(required);
                var additional = schema.get("additionalProperties");
                if (additional != null && additional.isBoolean()) {
                    builder.additionalProperties(additional.asBoolean());
                }
                yield builder.build();
            }
            case "string" -> JsonStringSchema.builder().description(description).build();
            case "integer" -> JsonIntegerSchema.builder().description(description).build();
            case "number" -> JsonNumberSchema.builder().description(description).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description).build();
            case "array" -> {
                var items = schema.get("items");
                yield JsonArraySchema.builder()
                        .description(description)
                        .items(items != null && items.isObject() ? fromJson(items) : anyValue(null))
                        .build();
            }
            case "null" -> new JsonNullSchema();
            default -> throw new UnsupportedSchemaException("Unsupported schema type: " + type);
        };
    }

    private static JsonSchemaElement anyValue(@Nullable String description) {
        return JsonAnyOfSchema.builder()
                .description(description)
                .anyOf(List.of(
                        JsonStringSchema.builder().build(),
                        JsonNumberSchema.builder().build(),
                        JsonBooleanSchema.builder().build(),
                        JsonObjectSchema.builder().build(),
                        new JsonNullSchema()))
                .build();
    }

    /** Renders a schema element back to a JSON Schema document, for catalog export. */
    public static ObjectNode toJson(JsonSchemaElement element) {
        var node = NODES.objectNode();
        if (element instanceof JsonObjectSchema obj) {
            node.put("type", "object");
            putDescription(node, obj.description());
            var props = node.putObject("properties");
            if (obj.properties() != null) {
                obj.properties().forEach((name, child) -> props.set(name, toJson(child)));
            }
            if (obj.required() != null && !obj.required().isEmpty()) {
                var req = node.putArray("required");
                obj.required().forEach(req::add);
            }
            if (obj.additionalProperties() != null) {
                node.put("additionalProperties", obj.additionalProperties());
            }
        } else if (element instanceof JsonStringSchema s) {
            node.put("type", "string");
            putDescription(node, s.description());
        } else if (element instanceof JsonIntegerSchema i) {
            node.put("type", "integer");
            putDescription(node, i.description());
        } else if (element instanceof JsonNumberSchema n) {
            node.put("type", "number");
            putDescription(node, n.description());
        } else if (element instanceof JsonBooleanSchema b) {
            node.put("type", "boolean");
            putDescription(node, b.description());
        } else if (element instanceof JsonEnumSchema e) {
            node.put("type", "string");
            putDescription(node, e.description());
            var values = node.putArray("enum");
            e.enumValues().forEach(values::add);
        } else if (element instanceof JsonArraySchema a) {
            node.put("type", "array");
            putDescription(node, a.description());
            if (a.items() != null) {
                node.set("items", toJson(a.items()));
            }
        } else if (element instanceof JsonAnyOfSchema any) {
            putDescription(node, any.description());
            var alternatives = node.putArray("anyOf");
            any.anyOf().forEach(alt -> alternatives.add(toJson(alt)));
        } else if (element instanceof JsonNullSchema) {
            node.put("type", "null");
        } else {
            throw new UnsupportedSchemaException("Unsupported schema element: " + element.getClass().getSimpleName());
        }
        return node;
    }

    private static void putDescription(ObjectNode node, @Nullable String description) {
        if (description != null) {
            node.put("description", description);
        }
    }

    /** Parses a JSON Schema string, mainly for tests and configuration. */
    public static JsonObjectSchema parseObjectSchema(String json) {
        try {
            return objectSchemaFromJson(OBJECT_MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new UnsupportedSchemaException("Malformed schema: " + e.getOriginalMessage());
        }
    }
}
