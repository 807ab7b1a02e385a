package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

/** Output of DECOMPOSITION. */
public record SplitResult(List<ChildDraft> children, String rationale) {

    public SplitResult {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
