package com.forgeloop.orchestrator.engine;

/**
 * The run is in divergence and cannot continue until an operator resolves it.
 * Carries the divergence report.
 */
public class VerificationDivergenceException extends RuntimeException {

    private final int attemptCount;
    private final String report;

    public VerificationDivergenceException(int attemptCount, String report) {
        super("Verification diverged after " + attemptCount + " attempts; operator approval required");
        this.attemptCount = attemptCount;
        this.report       = report;
    }

    public int    getAttemptCount() { return attemptCount; }
    public String getReport()       { return report; }
}
