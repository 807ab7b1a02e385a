package com.forgeloop.orchestrator.checkpoint;

import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.WorkProgress;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural invariants every stored checkpoint must satisfy.
 */
public final class CheckpointInvariants {

    private CheckpointInvariants() {}

    public static List<String> violations(Checkpoint cp) {
        List<String> violations = new ArrayList<>();
        WorkProgress wp = cp.getWorkProgress();

        Set<String> overlap = new HashSet<>(wp.getCompletedItems());
        overlap.retainAll(wp.getOpenItems());
        if (!overlap.isEmpty()) {
            violations.add("Items both completed and open: " + overlap);
        }
        String inProgress = wp.getInProgressItem();
        if (inProgress != null && !wp.getOpenItems().contains(inProgress)) {
            violations.add("In-progress item " + inProgress + " is not open");
        }
        int attempts    = cp.getVerification().getAttemptCount();
        int maxAttempts = cp.getVerification().getMaxAttempts();
        if (attempts < 0 || attempts > maxAttempts) {
            violations.add("Verification attempt %d outside [0, %d]".formatted(attempts, maxAttempts));
        }
        if (cp.getResourceTracking().getUsed() < 0) {
            violations.add("Negative resource usage");
        }
        return violations;
    }
}
