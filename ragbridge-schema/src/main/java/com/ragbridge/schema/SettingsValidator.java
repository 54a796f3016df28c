package com.ragbridge.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates configuration objects against a {@link SettingsSchema} and fills in declared defaults.
 * Properties the schema does not declare are accepted unchanged (Draft-7 {@code additionalProperties}
 * defaults to true). Null values are treated as absent.
 */
public final class SettingsValidator {

    private SettingsValidator() {
    }

    /**
     * Checks {@code settings} against {@code schema}: required properties, types, enums and numeric bounds.
     *
     * @return one message per violation; empty when valid
     */
    public static List<String> validate(SettingsSchema schema, Map<String, ?> settings) {
        return JsonSchemas.messages(schema.validator().validate(toNode(settings)));
    }

    /**
     * Returns a copy of {@code settings} where every declared property that is absent (or null) and has a
     * {@code default} is set to that default. Nested object properties are filled the same way.
     */
    public static Map<String, Object> applyDefaults(SettingsSchema schema, Map<String, ?> settings) {
        ObjectNode node = toNode(settings);
        schema.defaultsWalker().walk(node, false);
        return JsonSchemas.toMap(node);
    }

    /**
     * Applies defaults, then validates. Throws {@link InvalidSettingsException} naming {@code subject} when the
     * result does not satisfy the schema.
     *
     * @return the settings with defaults applied
     */
    public static Map<String, Object> validateAndApplyDefaults(String subject, SettingsSchema schema, Map<String, ?> settings) {
        Map<String, Object> withDefaults = applyDefaults(schema, settings);
        List<String> errors = validate(schema, withDefaults);
        if (!errors.isEmpty()) {
            throw new InvalidSettingsException(subject, errors);
        }
        return withDefaults;
    }

    private static ObjectNode toNode(Map<String, ?> settings) {
        Map<String, Object> present = new LinkedHashMap<>();
        if (settings != null) {
            settings.forEach((k, v) -> {
                if (v != null) present.put(k, v);
            });
        }
        return JsonSchemas.MAPPER.valueToTree(present);
    }
}
