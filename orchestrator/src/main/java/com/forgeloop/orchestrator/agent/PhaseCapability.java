package com.forgeloop.orchestrator.agent;

import com.forgeloop.orchestrator.model.PhaseId;

/**
 * The agent capabilities the orchestrator delegates to, one per phase.
 *
 * Each capability is a typed boundary: structured input in, structured
 * output out. Artifacts produced as a side effect (documents, code) are
 * only checked for existence, never inspected.
 */
public enum PhaseCapability {
    INFRA_SETUP(PhaseId.PHASE_0_INFRA),
    PRODUCT_DEFINITION(PhaseId.PHASE_1_DEFINITION),
    DECOMPOSITION(PhaseId.PHASE_1_5_DECOMPOSITION),
    ARCHITECTURE(PhaseId.PHASE_2_ARCHITECTURE),
    IMPLEMENTATION(PhaseId.PHASE_3_IMPLEMENTATION),
    QA(PhaseId.PHASE_4_QA),
    VERIFICATION(PhaseId.PHASE_5_VERIFICATION),
    LEARNING(PhaseId.PHASE_6_LEARNING);

    private final PhaseId phase;

    PhaseCapability(PhaseId phase) {
        this.phase = phase;
    }

    public PhaseId phase() { return phase; }
}
