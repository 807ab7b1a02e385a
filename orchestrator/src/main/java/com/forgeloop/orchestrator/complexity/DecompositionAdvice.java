package com.forgeloop.orchestrator.complexity;

import java.util.List;

/**
 * Children a COMPLEX item must be split into. Every child scores below the
 * Complex threshold and the blockedBy edges form a partial order.
 *
 * @param attempts 1 if the first split was accepted, 2 if it took the retry
 */
public record DecompositionAdvice(List<ScoredChild> children, String rationale, int attempts) {

    public DecompositionAdvice {
        children = List.copyOf(children);
    }
}
