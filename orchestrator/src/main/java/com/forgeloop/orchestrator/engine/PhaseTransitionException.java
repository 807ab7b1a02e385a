package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.model.PhaseId;

/**
 * A phase cannot be left because its completion predicate does not hold.
 */
public class PhaseTransitionException extends RuntimeException {

    private final PhaseId phase;

    public PhaseTransitionException(PhaseId phase, String reason) {
        super("Cannot complete phase " + phase.number() + " (" + phase.displayName() + "): " + reason);
        this.phase = phase;
    }

    public PhaseId getPhase() { return phase; }
}
