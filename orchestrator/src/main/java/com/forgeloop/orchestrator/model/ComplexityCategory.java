package com.forgeloop.orchestrator.model;

/**
 * Complexity classes derived from a work item's score.
 * COMPLEX items are never implemented directly; they are decomposed first.
 */
public enum ComplexityCategory {
    SIMPLE,
    MEDIUM,
    COMPLEX
}
