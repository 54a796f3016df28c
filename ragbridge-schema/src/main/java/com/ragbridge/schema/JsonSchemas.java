package com.ragbridge.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.ApplyDefaultsStrategy;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared Draft-7 factory and Jackson mapper for the schema package.
 */
final class JsonSchemas {

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final JsonSchemaFactory FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonSchemas() {
    }

    /** Integral doubles count as integers; messages are in English. */
    static SchemaValidatorsConfig validationConfig() {
        SchemaValidatorsConfig config = new SchemaValidatorsConfig();
        config.setLosslessNarrowing(true);
        config.setLocale(Locale.ENGLISH);
        return config;
    }

    /** Same as {@link #validationConfig()}, and walking fills absent properties with their {@code default}. */
    static SchemaValidatorsConfig defaultsConfig() {
        SchemaValidatorsConfig config = validationConfig();
        config.setApplyDefaultsStrategy(new ApplyDefaultsStrategy(true, true, false));
        return config;
    }

    static JsonSchema compile(JsonNode schema, SchemaValidatorsConfig config) {
        JsonSchema compiled = FACTORY.getSchema(schema, config);
        compiled.initializeValidators();
        return compiled;
    }

    static List<String> messages(Collection<ValidationMessage> messages) {
        List<String> out = new ArrayList<>(messages.size());
        for (ValidationMessage m : messages) out.add(m.getMessage());
        return out;
    }

    static Map<String, Object> toMap(JsonNode node) {
        return MAPPER.convertValue(node, MAP_TYPE);
    }
}
