/**
 * Failure taxonomy by origin.
 * <ul>
 *   <li>Host-origin ({@link com.ragbridge.errors.HostCapabilityException}): embedding, vector store,
 *       collection-not-found, file service.</li>
 *   <li>Plugin-origin: {@link com.ragbridge.errors.IngestionException} (parsing, chunking) and
 *       {@link com.ragbridge.errors.RetrievalException}.</li>
 *   <li>{@link com.ragbridge.errors.HostServiceException}: a host-origin failure re-surfaced by a plugin.</li>
 * </ul>
 * Nothing here is recovered inside the contract; every failure reaches the host caller.
 */
package com.ragbridge.errors;
