/**
 * Knowledge base lifecycle and dispatch to RAG components.
 */
package com.ragbridge.host.kb;
