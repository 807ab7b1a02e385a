package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.agent.contract.TestOutcome;
import com.forgeloop.orchestrator.agent.contract.VerificationResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.model.VerificationFailure;
import com.forgeloop.orchestrator.model.VerificationState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a verification attempt passes, after the two self-healing
 * exceptions are applied.
 *
 * <ol>
 *   <li>Flaky tests. Within the last {@code flakyWindow} attempts of the current
 *       loop (this one included) a test that failed at least twice and passed at
 *       least once is quarantined, but only when every test failing now is
 *       such a test. Earlier attempts of the loop all failed, so each has an
 *       entry in the failure history; a test missing from an entry passed.</li>
 *   <li>Coverage. A shortfall within {@code coverageTolerance} points of the
 *       target is accepted as a disclosed gap; below that it fails.</li>
 * </ol>
 */
@Component
public class VerificationPolicy {

    private final ForgeloopProperties.Verification config;

    public VerificationPolicy(ForgeloopProperties properties) {
        this.config = properties.getVerification();
    }

    public double coverageTarget(VerificationState state) {
        Double override = state.getCoverageTargetOverride();
        return override != null ? override : config.getCoverageTarget();
    }

    public VerificationVerdict evaluate(VerificationResult result, VerificationState state, int attempt) {
        List<TestOutcome> failing = result.failures().stream()
                .filter(t -> !state.getExcludedTests().contains(t.name()))
                .toList();

        Set<String> quarantined = new LinkedHashSet<>();
        List<TestOutcome> hardFailures = new ArrayList<>(failing);
        if (!failing.isEmpty()) {
            List<VerificationFailure> window = priorAttempts(state.getFailureHistory(), attempt);
            boolean allFlaky = failing.stream().allMatch(t -> isFlaky(t.name(), window));
            if (allFlaky) {
                failing.forEach(t -> quarantined.add(t.name()));
                hardFailures.clear();
            }
        }

        double target   = coverageTarget(state);
        double coverage = result.coveragePercent();
        Double gap = null;
        boolean coverageFailure = false;
        if (coverage < target) {
            if (coverage >= target - config.getCoverageTolerance()) {
                gap = coverage;
            } else {
                coverageFailure = true;
            }
        }

        boolean passed = hardFailures.isEmpty() && !coverageFailure;
        return new VerificationVerdict(passed, hardFailures, quarantined, gap, coverageFailure,
                describe(passed, hardFailures, coverageFailure, coverage, target));
    }

    /** The failure entries of the attempts immediately before this one in the current loop. */
    List<VerificationFailure> priorAttempts(List<VerificationFailure> history, int attempt) {
        List<VerificationFailure> window = new ArrayList<>();
        int wanted = attempt - 1;
        for (int i = history.size() - 1; i >= 0 && window.size() < config.getFlakyWindow() - 1; i--) {
            VerificationFailure entry = history.get(i);
            if (entry.getAttempt() != wanted) break;
            window.add(entry);
            wanted--;
        }
        return window;
    }

    private boolean isFlaky(String test, List<VerificationFailure> priorAttempts) {
        int failed = 1;   // the current attempt
        int passed = 0;
        for (VerificationFailure entry : priorAttempts) {
            if (entry.getFailingTests().contains(test)) failed++;
            else passed++;
        }
        return failed >= 2 && passed >= 1;
    }

    private static String describe(boolean passed, List<TestOutcome> failures, boolean coverageFailure,
                                   double coverage, double target) {
        if (passed) return "Verification passed";
        List<String> parts = new ArrayList<>();
        if (!failures.isEmpty()) {
            parts.add(failures.size() + " failing test(s): "
                    + String.join(", ", failures.stream().map(TestOutcome::name).toList()));
        }
        if (coverageFailure) {
            parts.add("coverage %.1f%% below target %.1f%%".formatted(coverage, target));
        }
        return String.join("; ", parts);
    }
}
