package com.forgeloop.orchestrator.engine;

/**
 * Why a call to {@link PhaseStateMachine#run} returned.
 */
public enum RunOutcome {
    /** All phases done. */
    COMPLETED,
    /** A time-budget gate is open; an operator must answer it. */
    AWAITING_APPROVAL,
    /** Verification retries exhausted; an operator must choose how to continue. */
    DIVERGENCE,
    /** The session's resource budget passed its warning ratio; resume in a fresh session. */
    SESSION_BUDGET_REACHED,
    /** An agent or tracker call failed; the checkpoint is as last written. */
    SUSPENDED,
    /** A structural error (bad decomposition, broken predicate, dependency deadlock) halted the run. */
    FAILED
}
