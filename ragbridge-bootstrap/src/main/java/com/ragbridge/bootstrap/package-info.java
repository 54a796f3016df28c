/**
 * Wiring of configuration, host capabilities and built-in components.
 */
package com.ragbridge.bootstrap;
