package com.ragbridge.engine.naive;

import com.ragbridge.host.HostServices;
import com.ragbridge.plugin.ComponentKind;
import com.ragbridge.plugin.ComponentProvider;
import com.ragbridge.plugin.RagComponent;

import java.util.List;
import java.util.Map;

/**
 * SPI provider for {@link NaiveRagEngine}.
 */
public final class NaiveRagEngineProvider implements ComponentProvider {

    @Override
    public String getComponentId() {
        return NaiveRagEngine.COMPONENT_ID;
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.RAG_ENGINE;
    }

    @Override
    public RagComponent create(HostServices hostServices) {
        return new NaiveRagEngine(hostServices);
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        return Map.of(
                "index_modes", List.of(TextChunker.MODE_GENERAL, TextChunker.MODE_PARAGRAPH),
                "content_types", List.of("text/plain", "text/markdown"),
                "rerank", "lexical");
    }
}
