package com.forgeloop.orchestrator.resume;

import com.forgeloop.orchestrator.model.PhaseId;

/**
 * Where a run re-enters after {@link ResumeController#resume()}.
 *
 * @param itemId              the implementation item that was in progress, or null
 * @param verificationAttempt the verification attempt to run next, or null outside a retry loop
 * @param newProject          true when no checkpoint existed
 */
public record ResumptionPoint(PhaseId phase,
                              String itemId,
                              Integer verificationAttempt,
                              ReconciliationReport reconciliation,
                              boolean newProject) {

    public static ResumptionPoint forNewProject() {
        return new ResumptionPoint(PhaseId.PHASE_0_INFRA, null, null, ReconciliationReport.empty(), true);
    }
}
