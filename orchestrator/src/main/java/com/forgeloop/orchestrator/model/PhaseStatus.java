package com.forgeloop.orchestrator.model;

/**
 * Status of the current phase.
 *
 *   NOT_STARTED       → IN_PROGRESS (phase entered)
 *   IN_PROGRESS       → COMPLETE (completion predicate holds)
 *   IN_PROGRESS       → AWAITING_APPROVAL (time budget breached)
 *   IN_PROGRESS       → DIVERGENCE (verification retries exhausted, phase 5 only)
 *   AWAITING_APPROVAL → IN_PROGRESS (operator answered the gate)
 *   DIVERGENCE        → IN_PROGRESS (operator approved a way out)
 */
public enum PhaseStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETE,
    AWAITING_APPROVAL,
    DIVERGENCE
}
