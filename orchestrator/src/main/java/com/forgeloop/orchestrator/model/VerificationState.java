package com.forgeloop.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Counters of the bounded verification loop.
 *
 * attemptCount is 0 outside verification, 1 on first entry, and never
 * exceeds maxAttempts.
 */
public class VerificationState {

    private int attemptCount;
    private int maxAttempts = 3;
    private Instant lastAttemptAt;
    private List<VerificationFailure> failureHistory = new ArrayList<>();
    private Double lastCoverage;

    // Operator decisions at a divergence gate.
    private Set<String> excludedTests = new LinkedHashSet<>();
    private Double coverageTargetOverride;

    public int                       getAttemptCount()   { return attemptCount; }
    public int                       getMaxAttempts()    { return maxAttempts; }
    public Instant                   getLastAttemptAt()  { return lastAttemptAt; }
    public List<VerificationFailure> getFailureHistory() { return failureHistory; }
    public Double                    getLastCoverage()   { return lastCoverage; }
    public Set<String>               getExcludedTests()  { return excludedTests; }
    public Double                    getCoverageTargetOverride() { return coverageTargetOverride; }

    public void setAttemptCount(int attemptCount)                  { this.attemptCount = attemptCount; }
    public void setMaxAttempts(int maxAttempts)                    { this.maxAttempts = maxAttempts; }
    public void setLastAttemptAt(Instant lastAttemptAt)            { this.lastAttemptAt = lastAttemptAt; }
    public void setFailureHistory(List<VerificationFailure> v)     { this.failureHistory = v; }
    public void setLastCoverage(Double lastCoverage)               { this.lastCoverage = lastCoverage; }
    public void setExcludedTests(Set<String> excludedTests)        { this.excludedTests = excludedTests; }
    public void setCoverageTargetOverride(Double v)                { this.coverageTargetOverride = v; }
}
