package com.ragbridge.engine.naive;

import com.ragbridge.host.HostServices;
import com.ragbridge.plugin.ComponentKind;
import com.ragbridge.plugin.ComponentProvider;
import com.ragbridge.plugin.RagComponent;

/**
 * SPI provider for {@link VectorKnowledgeRetriever}.
 */
public final class VectorKnowledgeRetrieverProvider implements ComponentProvider {

    @Override
    public String getComponentId() {
        return VectorKnowledgeRetriever.COMPONENT_ID;
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.KNOWLEDGE_RETRIEVER;
    }

    @Override
    public RagComponent create(HostServices hostServices) {
        return new VectorKnowledgeRetriever(hostServices);
    }
}
