package com.forgeloop.orchestrator.model;

/**
 * Phases of a build run, in execution order.
 *
 * Transitions (happy path):
 *   0 INFRA → 1 DEFINITION → 1.5 DECOMPOSITION → 2 ARCHITECTURE
 *     → 3 IMPLEMENTATION → 4 QA → 5 VERIFICATION → 6 LEARNING → DONE
 *
 * VERIFICATION may loop back to IMPLEMENTATION a bounded number of times.
 * Divergence is a status of VERIFICATION, not a phase of its own.
 */
public enum PhaseId {
    PHASE_0_INFRA("0", "Infrastructure"),
    PHASE_1_DEFINITION("1", "Product definition"),
    PHASE_1_5_DECOMPOSITION("1.5", "Decomposition"),
    PHASE_2_ARCHITECTURE("2", "Architecture"),
    PHASE_3_IMPLEMENTATION("3", "Implementation"),
    PHASE_4_QA("4", "Quality assurance"),
    PHASE_5_VERIFICATION("5", "Verification"),
    PHASE_6_LEARNING("6", "Learning"),
    DONE("done", "Done");

    private final String number;
    private final String displayName;

    PhaseId(String number, String displayName) {
        this.number      = number;
        this.displayName = displayName;
    }

    public String number()      { return number; }
    public String displayName() { return displayName; }

    /** The phase after this one, or DONE for the last phase. */
    public PhaseId next() {
        PhaseId[] all = values();
        return this == DONE ? DONE : all[ordinal() + 1];
    }

    public boolean isBefore(PhaseId other) {
        return ordinal() < other.ordinal();
    }
}
