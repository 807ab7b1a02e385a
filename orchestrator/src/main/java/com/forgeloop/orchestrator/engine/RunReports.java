package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.Disclosure;
import com.forgeloop.orchestrator.model.ResourceTracking;
import com.forgeloop.orchestrator.model.VerificationFailure;
import com.forgeloop.orchestrator.model.WorkItem;

import java.util.List;

/**
 * Plain-text reports produced at every hard stop. They are logged and
 * returned to the operator alongside the structured outcome.
 */
public final class RunReports {

    private RunReports() {}

    public static String divergence(Checkpoint cp) {
        StringBuilder sb = new StringBuilder();
        sb.append("DIVERGENCE REPORT: ").append(cp.getProject().getName()).append('\n');
        sb.append("Verification failed ").append(cp.getVerification().getAttemptCount())
          .append(" of ").append(cp.getVerification().getMaxAttempts()).append(" attempts.\n");
        for (VerificationFailure failure : cp.getVerification().getFailureHistory()) {
            sb.append("  attempt ").append(failure.getAttempt()).append(" at ").append(failure.getTimestamp())
              .append(": ").append(failure.getMessage()).append('\n');
        }
        sb.append("Options: NARROW_SCOPE (exclude the failing tests), RELAX_THRESHOLD (accept the last ")
          .append("measured coverage), MANUAL_INTERVENTION (fix by hand, then verify again).\n");
        return sb.toString();
    }

    public static String timeBudget(Checkpoint cp, String elapsed, String budget) {
        return "TIME BUDGET: phase %s (%s) has run %s against a budget of %s.%nOptions: EXTEND, REDUCE_SCOPE, PROCEED.%n"
                .formatted(cp.getPhase().getCurrent().number(), cp.getPhase().getName(), elapsed, budget);
    }

    public static String suspended(Checkpoint cp, String cause) {
        return "SUSPENDED in phase %s: %s%nThe checkpoint is unchanged since its last write; resume to retry.%n"
                .formatted(cp.getPhase().getCurrent().number(), cause);
    }

    public static String sessionBudget(ResourceTracking tracking) {
        return "SESSION BUDGET: used %d of %d in session %s. Resume to continue in a fresh session.%n"
                .formatted(tracking.getUsed(), tracking.getBudget(), tracking.getSessionId());
    }

    public static String finalReport(Checkpoint cp) {
        StringBuilder sb = new StringBuilder();
        sb.append("FINAL REPORT: ").append(cp.getProject().getName()).append('\n');
        sb.append("Items completed: ").append(cp.getWorkProgress().getCompletedItems().size())
          .append(", open: ").append(cp.getWorkProgress().getOpenItems().size()).append('\n');
        sb.append("Resource used: ").append(cp.getResourceTracking().getCumulativeUsed()).append('\n');

        List<WorkItem> untriaged = cp.getWorkItems().values().stream()
                .filter(item -> PhasePredicates.awaitsTriage(cp, item))
                .toList();
        if (!untriaged.isEmpty()) {
            sb.append("Untriaged items created outside the run:\n");
            untriaged.forEach(item -> sb.append("  #").append(item.getId()).append(' ').append(item.getTitle()).append('\n'));
        }
        if (cp.getDisclosures().isEmpty()) {
            sb.append("Disclosed compromises: none\n");
        } else {
            sb.append("Disclosed compromises:\n");
            for (Disclosure d : cp.getDisclosures()) {
                sb.append("  [").append(d.getType()).append("] ").append(d.getDetail())
                  .append(" (verification attempt ").append(d.getAttempt()).append(")\n");
            }
        }
        return sb.toString();
    }
}
