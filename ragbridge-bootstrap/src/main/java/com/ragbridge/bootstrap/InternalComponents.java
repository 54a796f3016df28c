package com.ragbridge.bootstrap;

import com.ragbridge.engine.naive.NaiveRagEngineProvider;
import com.ragbridge.engine.naive.VectorKnowledgeRetrieverProvider;
import com.ragbridge.plugin.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the built-in components and then any third-party providers found on the class path
 * ({@code META-INF/services/com.ragbridge.plugin.ComponentProvider}). Discovered providers that reuse a
 * built-in id are skipped.
 */
public final class InternalComponents {

    private static final Logger log = LoggerFactory.getLogger(InternalComponents.class);

    private InternalComponents() {
    }

    /**
     * @return the given registry, populated
     */
    public static ComponentRegistry registerAll(ComponentRegistry registry, ClassLoader classLoader) {
        registry.register(new NaiveRagEngineProvider());
        registry.register(new VectorKnowledgeRetrieverProvider());
        int discovered = registry.loadInstalled(classLoader);
        log.info("Components: 2 internal, {} discovered; registered={}", discovered, registry.getProviders().size());
        return registry;
    }
}
