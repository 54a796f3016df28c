package com.ragbridge.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable JSON Schema (Draft-7 subset) document describing a configuration object: the creation settings
 * of a knowledge base or the runtime settings of a retrieval call. It is inert data: the host renders and
 * validates against it, nothing in it is executed. Every instance has passed {@link SchemaGrammar#check} and
 * carries its compiled Draft-7 validators.
 * <p>
 * Two schemas are equal when their JSON documents are equal, so a stable engine returns equal schemas
 * across calls and restarts.
 */
public final class SettingsSchema {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Schema with no declared properties; any object validates against it. */
    public static final SettingsSchema EMPTY = new SettingsSchema(objectNode());

    private final ObjectNode node;
    private final JsonSchema validator;
    private final JsonSchema defaultsWalker;

    private SettingsSchema(ObjectNode node) {
        this.node = node;
        this.validator = JsonSchemas.compile(node, JsonSchemas.validationConfig());
        this.defaultsWalker = JsonSchemas.compile(node, JsonSchemas.defaultsConfig());
    }

    /**
     * Wraps a schema document after checking it against the grammar.
     *
     * @throws InvalidSettingsException if the document does not follow {@link SchemaGrammar}
     */
    public static SettingsSchema of(JsonNode document) {
        List<String> grammarErrors = SchemaGrammar.check(document);
        if (!grammarErrors.isEmpty()) {
            throw new InvalidSettingsException("settings schema", grammarErrors);
        }
        return new SettingsSchema(((ObjectNode) document).deepCopy());
    }

    public static SettingsSchema fromJson(String json) {
        try {
            return of(JsonSchemas.MAPPER.readTree(Objects.requireNonNull(json, "json")));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SettingsSchema fromMap(Map<String, ?> document) {
        return of(JsonSchemas.MAPPER.valueToTree(Objects.requireNonNull(document, "document")));
    }

    public static Builder builder() {
        return new Builder();
    }

    JsonSchema validator() {
        return validator;
    }

    /** Walking with this schema fills absent properties with their declared defaults. */
    JsonSchema defaultsWalker() {
        return defaultsWalker;
    }

    /** Returns a deep copy of the schema document. */
    public ObjectNode toJsonNode() {
        return node.deepCopy();
    }

    /** Returns the schema document as nested maps and lists (e.g. for a front-end payload). */
    public Map<String, Object> toMap() {
        return JsonSchemas.toMap(node);
    }

    public String toJson() {
        try {
            return JsonSchemas.MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Names of the top-level properties, in declaration order. */
    public Set<String> getPropertyNames() {
        Set<String> names = new LinkedHashSet<>();
        JsonNode props = node.get("properties");
        if (props != null) {
            for (Iterator<String> it = props.fieldNames(); it.hasNext(); ) {
                names.add(it.next());
            }
        }
        return names;
    }

    /** Names listed in the top-level {@code required} array. */
    public List<String> getRequired() {
        List<String> out = new ArrayList<>();
        JsonNode required = node.get("required");
        if (required != null) {
            for (JsonNode r : required) out.add(r.asText());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return node.equals(((SettingsSchema) o).node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }

    private static ObjectNode objectNode() {
        ObjectNode n = NODES.objectNode();
        n.put("type", "object");
        n.set("properties", NODES.objectNode());
        return n;
    }

    /**
     * Fluent builder for flat settings schemas, e.g.
     * <pre>
     * SettingsSchema.builder()
     *     .stringEnum("index_mode", "Indexing Mode", List.of("general", "paragraph"), "general")
     *     .integer("chunk_size", "Chunk Size", 100, 2000, 512)
     *     .required("index_mode")
     *     .build();
     * </pre>
     */
    public static final class Builder {
        private final ObjectNode root = objectNode();
        private final List<String> required = new ArrayList<>();

        private Builder() {
        }

        public Builder title(String title) {
            root.put("title", title);
            return this;
        }

        public Builder description(String description) {
            root.put("description", description);
            return this;
        }

        public Builder string(String name, String title, String defaultValue) {
            ObjectNode p = property(name, SchemaType.STRING, title);
            if (defaultValue != null) p.put("default", defaultValue);
            return this;
        }

        public Builder stringEnum(String name, String title, List<String> options, String defaultValue) {
            ObjectNode p = property(name, SchemaType.STRING, title);
            ArrayNode values = p.putArray("enum");
            for (String o : Objects.requireNonNull(options, "options")) values.add(o);
            if (defaultValue != null) p.put("default", defaultValue);
            return this;
        }

        public Builder integer(String name, String title, Integer minimum, Integer maximum, Integer defaultValue) {
            ObjectNode p = property(name, SchemaType.INTEGER, title);
            if (minimum != null) p.put("minimum", minimum);
            if (maximum != null) p.put("maximum", maximum);
            if (defaultValue != null) p.put("default", defaultValue);
            return this;
        }

        public Builder number(String name, String title, Double minimum, Double maximum, Double defaultValue) {
            ObjectNode p = property(name, SchemaType.NUMBER, title);
            if (minimum != null) p.put("minimum", minimum);
            if (maximum != null) p.put("maximum", maximum);
            if (defaultValue != null) p.put("default", defaultValue);
            return this;
        }

        public Builder bool(String name, String title, Boolean defaultValue) {
            ObjectNode p = property(name, SchemaType.BOOLEAN, title);
            if (defaultValue != null) p.put("default", defaultValue);
            return this;
        }

        /** Adds a description to an already declared property. */
        public Builder describe(String name, String description) {
            JsonNode p = root.get("properties").get(name);
            if (!(p instanceof ObjectNode)) {
                throw new IllegalArgumentException("Property not declared: " + name);
            }
            ((ObjectNode) p).put("description", description);
            return this;
        }

        public Builder required(String... names) {
            for (String n : names) {
                if (!required.contains(n)) required.add(n);
            }
            return this;
        }

        /**
         * @throws InvalidSettingsException if the declared properties do not form a valid schema
         *                                  (e.g. a default outside its bounds)
         */
        public SettingsSchema build() {
            ObjectNode doc = root.deepCopy();
            if (!required.isEmpty()) {
                ArrayNode r = doc.putArray("required");
                required.forEach(r::add);
            }
            return of(doc);
        }

        private ObjectNode property(String name, SchemaType type, String title) {
            Objects.requireNonNull(name, "name");
            ObjectNode props = (ObjectNode) root.get("properties");
            if (props.has(name)) {
                throw new IllegalArgumentException("Property already declared: " + name);
            }
            ObjectNode p = props.putObject(name);
            p.put("type", type.getCode());
            if (title != null) p.put("title", title);
            return p;
        }
    }
}
