package com.ragbridge.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminant of a RAG component. The host dispatches on this tag, never on the implementation class.
 */
public enum ComponentKind {

    /** Legacy retrieval-only component: no ingestion, no settings schemas. */
    KNOWLEDGE_RETRIEVER("KnowledgeRetriever"),

    /** Full engine: lifecycle hooks, ingestion, retrieval and settings schemas. */
    RAG_ENGINE("RAGEngine");

    private final String tag;

    ComponentKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * @throws IllegalArgumentException for an unknown tag
     */
    @JsonCreator
    public static ComponentKind fromTag(String tag) {
        for (ComponentKind kind : values()) {
            if (kind.tag.equals(tag)) return kind;
        }
        throw new IllegalArgumentException("Unknown component kind: " + tag);
    }
}
