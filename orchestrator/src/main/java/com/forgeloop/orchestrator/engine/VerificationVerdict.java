package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.agent.contract.TestOutcome;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one verification attempt after the self-healing rules.
 *
 * @param hardFailures    failing tests that count against the attempt
 * @param quarantined     flaky tests excluded from the gate on this attempt
 * @param coverageGap     measured coverage accepted inside the tolerance band, or null
 * @param coverageFailure true when coverage is below the tolerance band
 */
public record VerificationVerdict(boolean passed,
                                  List<TestOutcome> hardFailures,
                                  Set<String> quarantined,
                                  Double coverageGap,
                                  boolean coverageFailure,
                                  String message) {

    public VerificationVerdict {
        hardFailures = List.copyOf(hardFailures);
        quarantined  = Set.copyOf(quarantined);
    }

    public List<String> failingTestNames() {
        return hardFailures.stream().map(TestOutcome::name).toList();
    }
}
