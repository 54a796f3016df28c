package com.ragbridge.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Query-time input, read-only to the plugin. {@link #settings()} is free-form and follows the
 * retrieval settings schema of the engine serving the knowledge base (e.g. {@code top_k},
 * {@code similarity_threshold}, {@code enable_rerank}).
 */
public record RetrievalContext(
        @JsonProperty("query") String query,
        @JsonProperty("knowledge_base_id") String knowledgeBaseId,
        @JsonProperty("collection_id") String collectionId,
        @JsonProperty("settings") Map<String, Object> settings
) {
    public RetrievalContext {
        query = query != null ? query : "";
        settings = settings != null ? Settings.copyOf(settings) : Map.of();
    }

    public RetrievalContext(String query, String knowledgeBaseId, Map<String, Object> settings) {
        this(query, knowledgeBaseId, knowledgeBaseId, settings);
    }

    /** Returns a copy with the given settings (used by the host after applying schema defaults). */
    public RetrievalContext withSettings(Map<String, Object> newSettings) {
        return new RetrievalContext(query, knowledgeBaseId, collectionId, newSettings);
    }

    public Object get(String key) {
        return settings.get(Objects.requireNonNull(key, "key"));
    }

    public int getInt(String key, int defaultValue) {
        return Settings.intValue(settings.get(key), defaultValue);
    }

    public double getDouble(String key, double defaultValue) {
        return Settings.doubleValue(settings.get(key), defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return Settings.booleanValue(settings.get(key), defaultValue);
    }

    public String getString(String key, String defaultValue) {
        Object v = settings.get(key);
        return v != null ? v.toString() : defaultValue;
    }
}
