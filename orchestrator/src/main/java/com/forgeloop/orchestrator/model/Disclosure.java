package com.forgeloop.orchestrator.model;

import java.time.Instant;

/**
 * A compromise the run accepted instead of failing, e.g. a quarantined flaky
 * test or a coverage gap inside the tolerance band. Every disclosure is
 * listed in the final report.
 */
public class Disclosure {

    public enum Type { QUARANTINED_TEST, COVERAGE_GAP, SCOPE_REDUCED, THRESHOLD_RELAXED }

    private Type type;
    private String detail;
    private int attempt;
    private Instant recordedAt;

    public Disclosure() {}   // Jackson

    public Disclosure(Type type, String detail, int attempt, Instant recordedAt) {
        this.type       = type;
        this.detail     = detail;
        this.attempt    = attempt;
        this.recordedAt = recordedAt;
    }

    public Type    getType()       { return type; }
    public String  getDetail()     { return detail; }
    public int     getAttempt()    { return attempt; }
    public Instant getRecordedAt() { return recordedAt; }

    public void setType(Type type)                 { this.type = type; }
    public void setDetail(String detail)           { this.detail = detail; }
    public void setAttempt(int attempt)            { this.attempt = attempt; }
    public void setRecordedAt(Instant recordedAt)  { this.recordedAt = recordedAt; }
}
