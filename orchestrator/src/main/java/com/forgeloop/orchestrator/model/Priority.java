package com.forgeloop.orchestrator.model;

/**
 * Scheduling priority of a work item. Higher rank is scheduled first.
 */
public enum Priority {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() { return rank; }
}
