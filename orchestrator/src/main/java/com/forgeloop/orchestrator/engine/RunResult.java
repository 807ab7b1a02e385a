package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.model.PhaseId;

/**
 * @param itemId the item being worked on when the run stopped, if any
 * @param report human-readable explanation; never null
 */
public record RunResult(RunOutcome outcome, PhaseId phase, String itemId, String report) {

    public static RunResult of(RunOutcome outcome, PhaseId phase, String report) {
        return new RunResult(outcome, phase, null, report);
    }

    public boolean isTerminal() {
        return outcome == RunOutcome.COMPLETED;
    }
}
