package ai.mcpagent.tools;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SCHEMA =
            """
            {
              "type": "object",
              "properties": {
                "path": {"type": "string"},
                "limit": {"type": "integer"},
                "ratio": {"type": "number"},
                "recursive": {"type": "boolean"},
                "mode": {"enum": ["fast", "slow"]},
                "tags": {"type": "array", "items": {"type": "string"}},
                "options": {
                  "type": "object",
                  "properties": {"depth": {"type": "integer"}},
                  "required": ["depth"],
                  "additionalProperties": false
                },
                "target": {"anyOf": [{"type": "string"}, {"type": "integer"}]}
              },
              "required": ["path"]
            }
            """;

    private static java.util.List<String> validate(String args) throws Exception {
        JsonNode node = MAPPER.readTree(args);
        return SchemaValidator.validate(JsonSchemas.parseObjectSchema(SCHEMA), node);
    }

    @Test
    void conformingArgumentsPass() throws Exception {
        assertEquals(
                java.util.List.of(),
                validate(
                        """
                {"path": "a.txt", "limit": 3, "ratio": 0.5, "recursive": true, "mode": "fast",
                 "tags": ["x", "y"], "options": {"depth": 2}, "target": 7}
                """));
    }

    @Test
    void missingRequiredPropertyIsReported() throws Exception {
        var violations = validate("{\"limit\": 3}");
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("'path'"));
    }

    @Test
    void wrongTypesAreReported() throws Exception {
        var violations = validate("{\"path\": 1, \"limit\": \"three\", \"recursive\": \"yes\", \"ratio\": []}");
        assertEquals(4, violations.size(), violations.toString());
    }

    @Test
    void integralDoubleCountsAsInteger() throws Exception {
        assertTrue(validate("{\"path\": \"a\", \"limit\": 3.0}").isEmpty());
        assertFalse(validate("{\"path\": \"a\", \"limit\": 3.5}").isEmpty());
    }

    @Test
    void enumMembershipIsChecked() throws Exception {
        var violations = validate("{\"path\": \"a\", \"mode\": \"medium\"}");
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("$.mode"));
    }

    @Test
    void arrayItemsAreChecked() throws Exception {
        var violations = validate("{\"path\": \"a\", \"tags\": [\"ok\", 5]}");
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("$.tags[1]"));
    }

    @Test
    void nestedObjectsAreCheckedIncludingAdditionalProperties() throws Exception {
        var violations = validate("{\"path\": \"a\", \"options\": {\"extra\": 1}}");
        assertEquals(2, violations.size(), violations.toString());
        assertTrue(violations.stream().anyMatch(v -> v.contains("'depth'")));
        assertTrue(violations.stream().anyMatch(v -> v.startsWith("$.options.extra")));
    }

    @Test
    void anyOfNeedsOneMatchingAlternative() throws Exception {
        assertTrue(validate("{\"path\": \"a\", \"target\": \"name\"}").isEmpty());
        assertEquals(1, validate("{\"path\": \"a\", \"target\": true}").size());
    }

    @Test
    void nullForOptionalPropertyMeansAbsent() throws Exception {
        assertTrue(validate("{\"path\": \"a\", \"limit\": null}").isEmpty());
        assertEquals(1, validate("{\"path\": null}").size());
    }

    @Test
    void unknownPropertiesAreAllowedByDefault() throws Exception {
        assertTrue(validate("{\"path\": \"a\", \"whatever\": {}}").isEmpty());
    }
}
