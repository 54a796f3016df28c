package com.ragbridge.schema;

import com.ragbridge.errors.RagException;

import java.util.List;

/**
 * Thrown when a configuration object (knowledge base creation settings or retrieval settings) does not
 * satisfy the schema the engine declared for it, or when a schema document breaks {@link SchemaGrammar}.
 * Raised by the host before the engine is called.
 */
public final class InvalidSettingsException extends RagException {

    private final List<String> errors;

    public InvalidSettingsException(String subject, List<String> errors) {
        super("Invalid " + subject + ": "
                + (errors != null && !errors.isEmpty() ? String.join("; ", errors) : "validation failed"));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /** Violation messages, one per failed rule. */
    public List<String> getErrors() {
        return errors;
    }
}
