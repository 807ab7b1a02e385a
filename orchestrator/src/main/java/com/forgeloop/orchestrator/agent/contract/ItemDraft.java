package com.forgeloop.orchestrator.agent.contract;

import com.forgeloop.orchestrator.complexity.WorkItemEstimate;
import com.forgeloop.orchestrator.model.Priority;
import com.forgeloop.orchestrator.model.WorkItemKind;

import java.util.List;

/**
 * A work item proposed by an agent, before it exists in the tracker.
 * Dependencies refer to other drafts of the same batch by title.
 */
public record ItemDraft(String title,
                        String body,
                        WorkItemKind kind,
                        Priority priority,
                        WorkItemEstimate estimate,
                        List<String> dependsOnTitles) {

    public ItemDraft {
        if (kind == null) kind = WorkItemKind.FEATURE;
        if (priority == null) priority = Priority.MEDIUM;
        if (body == null) body = "";
        dependsOnTitles = dependsOnTitles == null ? List.of() : List.copyOf(dependsOnTitles);
    }
}
