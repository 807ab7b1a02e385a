package com.forgeloop.orchestrator.complexity;

import com.forgeloop.orchestrator.model.ComplexityCategory;

/**
 * Result of scoring one estimate.
 *
 * @param decompositionAdvice present only for COMPLEX items analysed with
 *                            {@link ComplexityAnalyzer#analyze}
 */
public record ComplexityAssessment(int score,
                                   ComplexityCategory category,
                                   long estimatedResource,
                                   DecompositionAdvice decompositionAdvice) {

    public boolean requiresDecomposition() {
        return category == ComplexityCategory.COMPLEX;
    }
}
