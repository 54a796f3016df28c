package com.ragbridge.plugin;

import com.ragbridge.host.HostServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of component providers by component id. The host resolves the id stored with a knowledge base and
 * creates one component instance per collection through {@link #create(String, HostServices)}.
 */
public final class ComponentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private static final ComponentRegistry INSTANCE = new ComponentRegistry();

    private final Map<String, ComponentProvider> providers = new ConcurrentHashMap<>();

    /** Process-wide registry. Tests and embedded hosts usually create their own. */
    public static ComponentRegistry getInstance() {
        return INSTANCE;
    }

    public ComponentRegistry() {
    }

    /**
     * Registers a provider under its component id.
     *
     * @throws IllegalArgumentException if the id is blank, the kind is missing, or the id is already registered
     */
    public void register(ComponentProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String id = normalize(provider.getComponentId());
        if (provider.getKind() == null) {
            throw new IllegalArgumentException("Component " + id + " declares no kind");
        }
        if (providers.putIfAbsent(id, provider) != null) {
            throw new IllegalArgumentException("Component already registered: " + id);
        }
        log.info("Registered component {} ({}, version {})", id, provider.getKind().getTag(), provider.getVersion());
    }

    /**
     * Discovers providers with {@link ServiceLoader} and registers the enabled ones. Providers whose id is already
     * registered are skipped; a warning is logged only when a different provider class claims the id.
     *
     * @return number of providers registered by this call
     */
    public int loadInstalled(ClassLoader classLoader) {
        ServiceLoader<ComponentProvider> loader = ServiceLoader.load(ComponentProvider.class,
                classLoader != null ? classLoader : Thread.currentThread().getContextClassLoader());
        int n = 0;
        for (ComponentProvider provider : loader) {
            if (!provider.isEnabled()) {
                log.debug("Component provider {} disabled; skipping", provider.getComponentId());
                continue;
            }
            ComponentProvider existing = providers.get(normalize(provider.getComponentId()));
            if (existing != null) {
                if (existing.getClass() == provider.getClass()) {
                    log.debug("Component {} already registered by {}; skipping", provider.getComponentId(),
                            existing.getClass().getName());
                } else {
                    log.warn("Component {} already registered by {}; skipping discovered provider {}",
                            provider.getComponentId(), existing.getClass().getName(), provider.getClass().getName());
                }
                continue;
            }
            register(provider);
            n++;
        }
        return n;
    }

    /** Returns the provider for the id, or null if not registered. */
    public ComponentProvider get(String componentId) {
        if (componentId == null || componentId.isBlank()) return null;
        return providers.get(componentId.trim());
    }

    /**
     * Returns the provider for the id.
     *
     * @throws IllegalArgumentException if not registered
     */
    public ComponentProvider require(String componentId) {
        ComponentProvider provider = get(componentId);
        if (provider == null) {
            throw new IllegalArgumentException("Unknown component: " + componentId);
        }
        return provider;
    }

    /**
     * Creates an instance bound to {@code hostServices} and checks that it is what the provider declared.
     *
     * @throws IllegalArgumentException if the id is unknown
     * @throws IllegalStateException    if the instance's kind does not match the provider, or it implements both
     *                                  component interfaces
     */
    public RagComponent create(String componentId, HostServices hostServices) {
        ComponentProvider provider = require(componentId);
        RagComponent component = Objects.requireNonNull(provider.create(hostServices),
                "provider " + componentId + " returned null");
        checkKind(componentId, provider.getKind(), component);
        return component;
    }

    /**
     * Creates an instance and returns it as the expected kind.
     *
     * @throws IllegalStateException if the component is of another kind
     */
    public <T extends RagComponent> T create(String componentId, HostServices hostServices, Class<T> type) {
        RagComponent component = create(componentId, hostServices);
        if (!type.isInstance(component)) {
            throw new IllegalStateException("Component " + componentId + " is a " + component.getKind().getTag()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(component);
    }

    /** Registered providers, ordered by component id. */
    public List<ComponentProvider> getProviders() {
        List<ComponentProvider> out = new ArrayList<>(providers.values());
        out.sort((a, b) -> normalize(a.getComponentId()).compareTo(normalize(b.getComponentId())));
        return Collections.unmodifiableList(out);
    }

    /** Removes all registrations (mainly for tests). */
    public void clear() {
        providers.clear();
    }

    static void checkKind(String componentId, ComponentKind declared, RagComponent component) {
        boolean retriever = component instanceof KnowledgeRetriever;
        boolean engine = component instanceof RagEngine;
        if (retriever && engine) {
            throw new IllegalStateException("Component " + componentId + " implements both KnowledgeRetriever and RagEngine");
        }
        ComponentKind actual = engine ? ComponentKind.RAG_ENGINE : retriever ? ComponentKind.KNOWLEDGE_RETRIEVER : null;
        if (actual == null || actual != component.getKind() || actual != declared) {
            throw new IllegalStateException("Component " + componentId + " declares kind " + declared
                    + " but created " + component.getClass().getName() + " (" + component.getKind() + ")");
        }
    }

    private static String normalize(String componentId) {
        String id = Objects.requireNonNull(componentId, "componentId").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Component id must be non-blank");
        }
        return id;
    }
}
