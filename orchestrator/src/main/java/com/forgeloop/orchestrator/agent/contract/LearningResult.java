package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

/** Output of LEARNING: reusable patterns worth keeping from this run. */
public record LearningResult(List<String> patterns) {

    public LearningResult {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
}
