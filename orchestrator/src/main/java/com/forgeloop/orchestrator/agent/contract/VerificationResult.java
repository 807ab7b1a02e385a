package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

/** Output of VERIFICATION: every test outcome plus line coverage in percent. */
public record VerificationResult(List<TestOutcome> tests, double coveragePercent) {

    public VerificationResult {
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    public List<TestOutcome> failures() {
        return tests.stream().filter(t -> !t.passed()).toList();
    }
}
