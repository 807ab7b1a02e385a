package com.forgeloop.orchestrator.complexity;

/**
 * Estimated shape of a work item.
 *
 * @param files        files touched
 * @param loc          implementation lines of code
 * @param dependencies number of other items this one integrates with
 */
public record WorkItemEstimate(int files, int loc, int dependencies) {

    public WorkItemEstimate {
        if (files < 0 || loc < 0 || dependencies < 0) {
            throw new IllegalArgumentException(
                    "Estimate must not be negative: files=%d loc=%d dependencies=%d".formatted(files, loc, dependencies));
        }
    }
}
