/**
 * RAG component contract, provider SPI and registry.
 * <ul>
 *   <li>{@link com.ragbridge.plugin.RagComponent} – common supertype carrying the {@link com.ragbridge.plugin.ComponentKind} tag</li>
 *   <li>{@link com.ragbridge.plugin.KnowledgeRetriever} – legacy retrieval-only contract</li>
 *   <li>{@link com.ragbridge.plugin.RagEngine} – lifecycle hooks, ingestion, retrieval, settings schemas</li>
 *   <li>{@link com.ragbridge.plugin.ComponentProvider} – SPI for discovery (ServiceLoader)</li>
 *   <li>{@link com.ragbridge.plugin.ComponentRegistry} – registration by id and kind-checked instance creation</li>
 * </ul>
 */
package com.ragbridge.plugin;
