/**
 * Values exchanged across the host/plugin boundary. All types are immutable and passed by value.
 * <ul>
 *   <li>{@link com.ragbridge.entities.IngestionContext} / {@link com.ragbridge.entities.IngestionResult} – ingest call</li>
 *   <li>{@link com.ragbridge.entities.RetrievalContext} / {@link com.ragbridge.entities.RetrievalResponse} – retrieve call</li>
 *   <li>{@link com.ragbridge.entities.RetrievalResultEntry} – one hit; lower distance is closer</li>
 *   <li>{@link com.ragbridge.entities.FileStreamHandle} – release token for a host file stream</li>
 * </ul>
 */
package com.ragbridge.entities;
