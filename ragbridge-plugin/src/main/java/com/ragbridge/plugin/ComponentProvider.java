package com.ragbridge.plugin;

import com.ragbridge.host.HostServices;

import java.util.Collections;
import java.util.Map;

/**
 * SPI for RAG components. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.ragbridge.plugin.ComponentProvider) or registered explicitly with
 * {@link ComponentRegistry#register(ComponentProvider)}.
 */
public interface ComponentProvider {

    /** Component id (e.g. "naive-rag"). Unique within a registry. */
    String getComponentId();

    /** Kind of the instances {@link #create} returns. */
    ComponentKind getKind();

    /**
     * Creates a component instance bound to one collection. Called once per knowledge base; the instance
     * keeps {@code hostServices} for its whole lifetime.
     */
    RagComponent create(HostServices hostServices);

    /**
     * Component version for compatibility and audit (e.g. "1.0").
     */
    default String getVersion() {
        return "1.0";
    }

    /**
     * Optional capability metadata (e.g. supported index modes). Empty by default.
     */
    default Map<String, Object> getCapabilityMetadata() {
        return Collections.emptyMap();
    }

    /**
     * Whether this provider should be registered. Override to skip registration when required configuration is missing.
     */
    default boolean isEnabled() {
        return true;
    }
}
