/**
 * Bundled RAG components: {@link com.ragbridge.engine.naive.NaiveRagEngine} ({@code naive-rag}) and the legacy
 * {@link com.ragbridge.engine.naive.VectorKnowledgeRetriever} ({@code vector-retriever}). Both are registered through
 * {@code META-INF/services/com.ragbridge.plugin.ComponentProvider}.
 */
package com.ragbridge.engine.naive;
