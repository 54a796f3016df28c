package com.ragbridge.host.kb;

/**
 * Lifecycle of a knowledge base as tracked by {@link KnowledgeBaseService}.
 */
public enum KnowledgeBaseState {
    /** Never created, or removed after deletion. */
    ABSENT,
    /** Component instance bound; create hook not yet finished. */
    CREATED,
    /** Accepting ingest, delete-document and retrieve. */
    ACTIVE,
    /** Delete requested or finished; no new operations. */
    DELETED
}
