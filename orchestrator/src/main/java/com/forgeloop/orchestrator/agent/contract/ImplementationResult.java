package com.forgeloop.orchestrator.agent.contract;

import com.forgeloop.orchestrator.complexity.WorkItemEstimate;

import java.util.List;

/**
 * Output of one IMPLEMENTATION sub-unit.
 *
 * @param cost              resource actually consumed by this sub-unit
 * @param remainingEstimate shape of the work left when itemComplete is false
 */
public record ImplementationResult(boolean itemComplete,
                                   long cost,
                                   List<String> artifacts,
                                   WorkItemEstimate remainingEstimate,
                                   String summary) {

    public ImplementationResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
