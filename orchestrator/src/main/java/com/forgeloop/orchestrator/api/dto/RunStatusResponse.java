package com.forgeloop.orchestrator.api.dto;

import com.forgeloop.orchestrator.engine.RunOutcome;
import com.forgeloop.orchestrator.service.RunStatus;

/**
 * Response body for GET /runs/status.
 * checkpoint is null before the first start; lastOutcome is null until a run stops.
 */
public record RunStatusResponse(
        boolean        active,
        CheckpointView checkpoint,
        RunOutcome     lastOutcome,
        String         lastReport
) {
    public static RunStatusResponse from(RunStatus status) {
        return new RunStatusResponse(
                status.active(),
                status.checkpoint() == null ? null : CheckpointView.from(status.checkpoint()),
                status.lastResult() == null ? null : status.lastResult().outcome(),
                status.lastResult() == null ? null : status.lastResult().report()
        );
    }
}
