package com.forgeloop.orchestrator.complexity;

import com.forgeloop.orchestrator.model.ComplexityCategory;

import java.util.List;

/**
 * A validated child of a decomposed item, re-scored.
 *
 * @param blockedBy indices of sibling children that must complete first
 */
public record ScoredChild(String title,
                          WorkItemEstimate estimate,
                          int score,
                          ComplexityCategory category,
                          long estimatedResource,
                          List<Integer> blockedBy) {

    public ScoredChild {
        blockedBy = List.copyOf(blockedBy);
    }
}
