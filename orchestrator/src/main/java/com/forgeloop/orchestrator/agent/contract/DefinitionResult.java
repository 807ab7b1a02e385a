package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

/** Output of PRODUCT_DEFINITION: the PRD artifact and the initial work items. */
public record DefinitionResult(String prdArtifact, List<ItemDraft> items) {

    public DefinitionResult {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
