/**
 * Self-contained capability implementations for local runs and tests.
 */
package com.ragbridge.host.local;
