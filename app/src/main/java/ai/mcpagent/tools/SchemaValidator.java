package ai.mcpagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Checks tool arguments against an input schema before anything is sent to a server. */
public final class SchemaValidator {
    private SchemaValidator() {}

    /** Returns the violations found, empty when the arguments conform. */
    public static List<String> validate(JsonObjectSchema schema, JsonNode arguments) {
        var violations = new ArrayList<String>();
        check(schema, arguments, "$", violations);
        return violations;
    }

    private static void check(JsonSchemaElement schema, JsonNode value, String path, List<String> out) {
        if (schema instanceof JsonObjectSchema obj) {
            if (!value.isObject()) {
                out.add("%s: expected object but got %s".formatted(path, describe(value)));
                return;
            }
            Map<String, JsonSchemaElement> properties = obj.properties() == null ? Map.of() : obj.properties();
            if (obj.required() != null) {
                for (var name : obj.required()) {
                    if (!value.has(name)) {
                        out.add("%s: missing required property '%s'".formatted(path, name));
                    }
                }
            }
            var fields = value.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                var propertySchema = properties.get(field.getKey());
                var childPath = path + "." + field.getKey();
                boolean optional = obj.required() == null || !obj.required().contains(field.getKey());
                if (propertySchema != null && optional && field.getValue().isNull()) {
                    // an explicit null for an optional property means "not given"
                    continue;
                }
                if (propertySchema != null) {
                    check(propertySchema, field.getValue(), childPath, out);
                } else if (Boolean.FALSE.equals(obj.additionalProperties())) {
                    out.add("%s: unexpected property".formatted(childPath));
                }
            }
        } else if (schema instanceof JsonStringSchema) {
            if (!value.isTextual()) {
                out.add("%s: expected string but got %s".formatted(path, describe(value)));
            }
        } else if (schema instanceof JsonIntegerSchema) {
            if (!value.isIntegralNumber() && !(value.isNumber() && value.asDouble() == Math.rint(value.asDouble()))) {
                out.add("%s: expected integer but got %s".formatted(path, describe(value)));
            }
        } else if (schema instanceof JsonNumberSchema) {
            if (!value.isNumber()) {
                out.add("%s: expected number but got %s".formatted(path, describe(value)));
            }
        } else if (schema instanceof JsonBooleanSchema) {
            if (!value.isBoolean()) {
                out.add("%s: expected boolean but got %s".formatted(path, describe(value)));
            }
        } else if (schema instanceof JsonEnumSchema enumSchema) {
            if (!value.isValueNode() || value.isNull() || !enumSchema.enumValues().contains(value.asText())) {
                out.add("%s: %s is not one of %s".formatted(path, value, enumSchema.enumValues()));
            }
        } else if (schema instanceof JsonArraySchema array) {
            if (!value.isArray()) {
                out.add("%s: expected array but got %s".formatted(path, describe(value)));
                return;
            }
            if (array.items() != null) {
                for (int i = 0; i < value.size(); i++) {
                    check(array.items(), value.get(i), path + "[" + i + "]", out);
                }
            }
        } else if (schema instanceof JsonAnyOfSchema anyOf) {
            for (var alternative : anyOf.anyOf()) {
                var attempt = new ArrayList<String>();
                check(alternative, value, path, attempt);
                if (attempt.isEmpty()) {
                    return;
                }
            }
            out.add("%s: %s matches none of the allowed alternatives".formatted(path, describe(value)));
        } else if (schema instanceof JsonNullSchema) {
            if (!value.isNull()) {
                out.add("%s: expected null but got %s".formatted(path, describe(value)));
            }
        }
        // other element kinds carry no constraints we enforce
    }

    private static String describe(JsonNode value) {
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
