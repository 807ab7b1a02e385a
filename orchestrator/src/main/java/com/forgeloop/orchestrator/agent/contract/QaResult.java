package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

/** Output of QA: bugs found, each becoming a new BUG work item. */
public record QaResult(List<ItemDraft> bugs) {

    public QaResult {
        bugs = bugs == null ? List.of() : List.copyOf(bugs);
    }
}
