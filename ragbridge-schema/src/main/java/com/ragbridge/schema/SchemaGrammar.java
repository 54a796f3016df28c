package com.ragbridge.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.SchemaId;
import com.networknt.schema.SchemaLocation;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Fixed grammar a settings schema must follow before the host trusts it. Schemas are data: this class
 * only inspects them and never evaluates anything a schema contains.
 * <p>
 * A document must be valid Draft-7 and match {@code settings-grammar.json}: root {@code type: "object"} with
 * {@code properties} and optional {@code required}; each property declares a {@code type} (string, integer,
 * number, boolean, object) and may use only {@code title}, {@code description}, {@code enum}, {@code default},
 * {@code minimum}/{@code maximum} (numeric types) and, for nested objects, {@code properties}/{@code required}.
 * Enum values and defaults must themselves satisfy the property they belong to.
 */
public final class SchemaGrammar {

    private static final JsonSchema META_SCHEMA = JsonSchemas.FACTORY.getSchema(
            SchemaLocation.of(SchemaId.V7), JsonSchemas.validationConfig());
    private static final JsonSchema GRAMMAR = JsonSchemas.compile(loadGrammar(), JsonSchemas.validationConfig());

    private SchemaGrammar() {
    }

    /**
     * @return the problems found; empty when the document is a usable settings schema
     */
    public static List<String> check(JsonNode schema) {
        if (schema == null || !schema.isObject()) {
            return List.of("Schema must be a JSON object");
        }
        List<String> errors = new ArrayList<>(JsonSchemas.messages(META_SCHEMA.validate(schema)));
        errors.addAll(JsonSchemas.messages(GRAMMAR.validate(schema)));
        if (errors.isEmpty()) {
            checkValues("$", schema, errors);
        }
        return errors;
    }

    private static void checkValues(String path, JsonNode node, List<String> errors) {
        JsonNode enumNode = node.get("enum");
        if (enumNode != null) {
            ObjectNode typeOnly = ((ObjectNode) node).deepCopy();
            typeOnly.remove(List.of("enum", "default"));
            JsonSchema valueSchema = JsonSchemas.compile(typeOnly, JsonSchemas.validationConfig());
            for (JsonNode value : enumNode) {
                for (String m : JsonSchemas.messages(valueSchema.validate(value))) {
                    errors.add(path + ".enum " + value + ": " + m);
                }
            }
        }
        JsonNode def = node.get("default");
        if (def != null) {
            JsonSchema propertySchema = JsonSchemas.compile(node, JsonSchemas.validationConfig());
            for (String m : JsonSchemas.messages(propertySchema.validate(def))) {
                errors.add(path + ".default: " + m);
            }
        }
        JsonNode min = node.get("minimum");
        JsonNode max = node.get("maximum");
        if (min != null && max != null && min.asDouble() > max.asDouble()) {
            errors.add(path + ": 'minimum' is greater than 'maximum'");
        }
        JsonNode props = node.get("properties");
        JsonNode required = node.get("required");
        if (required != null) {
            for (JsonNode r : required) {
                if (props == null || !props.has(r.asText())) {
                    errors.add(path + ": required property '" + r.asText() + "' is not declared");
                }
            }
        }
        if (props != null) {
            for (Iterator<Map.Entry<String, JsonNode>> it = props.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                checkValues(path + ".properties." + e.getKey(), e.getValue(), errors);
            }
        }
    }

    private static JsonNode loadGrammar() {
        try (InputStream in = SchemaGrammar.class.getResourceAsStream("settings-grammar.json")) {
            if (in == null) {
                throw new IllegalStateException("settings-grammar.json not found on the class path");
            }
            return JsonSchemas.MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
