package com.forgeloop.orchestrator.api.dto;

import com.forgeloop.orchestrator.resume.ReconciliationReport;
import com.forgeloop.orchestrator.resume.ResumptionPoint;

import java.util.List;

/** Response body for POST /runs/resume: where the run re-entered and what reconciliation changed. */
public record ResumeResponse(
        String       phase,
        String       itemId,
        Integer      verificationAttempt,
        List<String> closedExternally,
        List<String> reopenedExternally,
        List<String> createdExternally,
        List<String> deletedExternally,
        String       reconciliationLog
) {
    public static ResumeResponse from(ResumptionPoint point) {
        ReconciliationReport report = point.reconciliation();
        return new ResumeResponse(
                point.phase().number(),
                point.itemId(),
                point.verificationAttempt(),
                report.closedExternally(),
                report.reopenedExternally(),
                report.createdExternally().stream().map(item -> item.id()).toList(),
                report.deletedExternally(),
                report.render()
        );
    }
}
