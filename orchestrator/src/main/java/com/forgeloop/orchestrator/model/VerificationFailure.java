package com.forgeloop.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One failed verification attempt.
 */
public class VerificationFailure {

    private int attempt;
    private String message;
    private Instant timestamp;
    private List<String> failingTests = new ArrayList<>();

    public VerificationFailure() {}   // Jackson

    public VerificationFailure(int attempt, String message, Instant timestamp, List<String> failingTests) {
        this.attempt      = attempt;
        this.message      = message;
        this.timestamp    = timestamp;
        this.failingTests = new ArrayList<>(failingTests);
    }

    public int          getAttempt()      { return attempt; }
    public String       getMessage()      { return message; }
    public Instant      getTimestamp()    { return timestamp; }
    public List<String> getFailingTests() { return failingTests; }

    public void setAttempt(int attempt)                  { this.attempt = attempt; }
    public void setMessage(String message)               { this.message = message; }
    public void setTimestamp(Instant timestamp)          { this.timestamp = timestamp; }
    public void setFailingTests(List<String> v)          { this.failingTests = v; }
}
