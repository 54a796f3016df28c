/**
 * Per-plugin-instance host services: collection scoping of the vector store and exactly-once file stream release.
 */
package com.ragbridge.host.services;
