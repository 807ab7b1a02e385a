package com.forgeloop.orchestrator.api.dto;

import com.forgeloop.orchestrator.model.ApprovalDecision;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.PendingApproval;
import com.forgeloop.orchestrator.model.PhaseStatus;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Operator view of a checkpoint: where the run is and what it is waiting for.
 */
public record CheckpointView(
        String       projectName,
        String       phase,
        String       phaseName,
        PhaseStatus  status,
        List<String> phasesCompleted,
        int          totalItems,
        Set<String>  openItems,
        Set<String>  completedItems,
        String       inProgressItem,
        Set<String>  flaggedItems,
        int          verificationAttempt,
        long         resourceUsed,
        long         resourceBudget,
        Approval     pendingApproval,
        String       resumeHint,
        Instant      lastUpdated
) {

    public record Approval(String kind, String phase, String reason, Set<ApprovalDecision> options) {

        static Approval from(PendingApproval pending) {
            if (pending == null) return null;
            return new Approval(pending.getKind().name(), pending.getPhase().number(), pending.getReason(),
                    pending.getKind().options());
        }
    }

    public static CheckpointView from(Checkpoint cp) {
        return new CheckpointView(
                cp.getProject().getName(),
                cp.getPhase().getCurrent().number(),
                cp.getPhase().getCurrent().displayName(),
                cp.getPhase().getStatus(),
                cp.getPhasesCompleted().stream().map(p -> p.number()).toList(),
                cp.getWorkProgress().getTotalItems(),
                cp.getWorkProgress().getOpenItems(),
                cp.getWorkProgress().getCompletedItems(),
                cp.getWorkProgress().getInProgressItem(),
                cp.getWorkProgress().getFlaggedItems(),
                cp.getVerification().getAttemptCount(),
                cp.getResourceTracking().getUsed(),
                cp.getResourceTracking().getBudget(),
                Approval.from(cp.getPendingApproval()),
                cp.getResumeHint(),
                cp.getProject().getLastUpdated()
        );
    }
}
