package com.forgeloop.orchestrator.agent.contract;

import com.forgeloop.orchestrator.complexity.WorkItemEstimate;

import java.util.List;

/**
 * One child of a split.
 *
 * @param blockedBy indices (into the same child list) of the children that
 *                  must be completed before this one
 */
public record ChildDraft(String title, WorkItemEstimate estimate, List<Integer> blockedBy) {

    public ChildDraft {
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
    }
}
