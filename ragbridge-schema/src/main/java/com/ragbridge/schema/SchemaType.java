package com.ragbridge.schema;

/**
 * JSON Schema {@code type} values accepted in settings schemas.
 */
public enum SchemaType {
    OBJECT("object"), STRING("string"), INTEGER("integer"), NUMBER("number"), BOOLEAN("boolean");

    private final String code;

    SchemaType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
