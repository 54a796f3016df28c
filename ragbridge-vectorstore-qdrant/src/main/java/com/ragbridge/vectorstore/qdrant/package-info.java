/**
 * Qdrant-backed {@link com.ragbridge.host.VectorStore} over the REST API, plus translation of the shared metadata
 * filter grammar into Qdrant filters.
 */
package com.ragbridge.vectorstore.qdrant;
