package com.forgeloop.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Gates that stop the run until an operator answers.
 */
public enum ApprovalKind {
    TIME_BUDGET(EnumSet.of(ApprovalDecision.EXTEND, ApprovalDecision.REDUCE_SCOPE, ApprovalDecision.PROCEED)),
    DIVERGENCE(EnumSet.of(ApprovalDecision.NARROW_SCOPE, ApprovalDecision.RELAX_THRESHOLD,
            ApprovalDecision.MANUAL_INTERVENTION));

    private final Set<ApprovalDecision> options;

    ApprovalKind(Set<ApprovalDecision> options) {
        this.options = options;
    }

    public Set<ApprovalDecision> options() { return options; }
}
