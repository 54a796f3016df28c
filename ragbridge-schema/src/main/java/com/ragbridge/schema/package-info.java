/**
 * Settings schemas declared by RAG engines. {@link com.ragbridge.schema.SettingsSchema} documents are
 * checked against {@link com.ragbridge.schema.SchemaGrammar} before use, and configuration objects are
 * checked (and completed with defaults) by {@link com.ragbridge.schema.SettingsValidator}. Validation runs on
 * the networknt Draft-7 validator.
 */
package com.ragbridge.schema;
