package com.ragbridge.plugin;

/**
 * Common supertype of {@link KnowledgeRetriever} and {@link RagEngine}. The two are siblings: a class
 * implementing both inherits conflicting {@link #getKind()} defaults and is rejected by the registry.
 */
public interface RagComponent {

    ComponentKind getKind();
}
