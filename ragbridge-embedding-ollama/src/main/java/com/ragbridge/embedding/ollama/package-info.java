/**
 * Ollama-backed {@link com.ragbridge.host.Embedder}.
 */
package com.ragbridge.embedding.ollama;
