package com.forgeloop.orchestrator.model;

public enum ApprovalDecision {
    // Time-budget gate
    EXTEND,
    REDUCE_SCOPE,
    PROCEED,
    // Divergence gate
    NARROW_SCOPE,
    RELAX_THRESHOLD,
    MANUAL_INTERVENTION
}
