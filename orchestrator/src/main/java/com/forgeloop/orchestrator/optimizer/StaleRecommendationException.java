package com.forgeloop.orchestrator.optimizer;

/**
 * A recommendation was computed against a threshold value that has since changed.
 */
public class StaleRecommendationException extends RuntimeException {

    public StaleRecommendationException(String message) {
        super(message);
    }
}
