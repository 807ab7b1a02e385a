package com.forgeloop.orchestrator.complexity;

import com.forgeloop.orchestrator.agent.AgentGateway;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.contract.ChildDraft;
import com.forgeloop.orchestrator.agent.contract.SplitRequest;
import com.forgeloop.orchestrator.agent.contract.SplitResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.config.TunableThresholds;
import com.forgeloop.orchestrator.model.ComplexityCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores work items and validates decompositions of COMPLEX ones.
 *
 * <pre>
 *   score    = files * fileWeight + loc + dependencies * dependencyWeight
 *   category = SIMPLE  [0, simpleMax]
 *              MEDIUM  [simpleMax + 1, mediumMax]
 *              COMPLEX [mediumMax + 1, ∞)
 *   resource = base + files * perFile + loc * perLine
 *              + round(loc * testRatio) * perTestLine + review
 * </pre>
 *
 * Category boundaries are read from {@link TunableThresholds} on every call,
 * so an approved threshold change takes effect immediately. Scoring is pure;
 * only {@link #decompose} talks to an agent.
 */
@Component
public class ComplexityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final ForgeloopProperties.Complexity weights;
    private final ForgeloopProperties.Cost       cost;
    private final TunableThresholds              thresholds;
    private final AgentGateway                   agents;

    public ComplexityAnalyzer(ForgeloopProperties properties, TunableThresholds thresholds, AgentGateway agents) {
        this.weights    = properties.getComplexity();
        this.cost       = properties.getCost();
        this.thresholds = thresholds;
        this.agents     = agents;
    }

    // ------------------------------------------------------------------
    // Pure scoring
    // ------------------------------------------------------------------

    /**
     * @throws IllegalArgumentException if the estimate is too large to score
     */
    public int score(WorkItemEstimate estimate) {
        long score = (long) estimate.files() * weights.getFileWeight()
                + estimate.loc()
                + (long) estimate.dependencies() * weights.getDependencyWeight();
        if (score > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Estimate too large to score: " + estimate);
        }
        return (int) score;
    }

    /** Total over all non-negative scores: every score lands in exactly one category. */
    public ComplexityCategory classify(long score) {
        if (score < 0) {
            throw new IllegalArgumentException("Complexity score must not be negative: " + score);
        }
        if (score <= thresholds.simpleMax()) return ComplexityCategory.SIMPLE;
        if (score <= thresholds.mediumMax()) return ComplexityCategory.MEDIUM;
        return ComplexityCategory.COMPLEX;
    }

    public long estimateResource(WorkItemEstimate estimate) {
        long testLoc = Math.round(estimate.loc() * cost.getTestRatio());
        return cost.getBaseContext()
                + estimate.files() * cost.getPerFile()
                + estimate.loc() * cost.getPerLine()
                + testLoc * cost.getPerTestLine()
                + cost.getReview();
    }

    /** Score, category and resource estimate, without decomposition advice. */
    public ComplexityAssessment assess(WorkItemEstimate estimate) {
        int score = score(estimate);
        return new ComplexityAssessment(score, classify(score), estimateResource(estimate), null);
    }

    /**
     * Full analysis of an item. COMPLEX items always come back with
     * decomposition advice, obtained from the decomposition agent.
     */
    public ComplexityAssessment analyze(String itemId, String title, WorkItemEstimate estimate) {
        ComplexityAssessment assessment = assess(estimate);
        if (!assessment.requiresDecomposition()) {
            return assessment;
        }
        return new ComplexityAssessment(assessment.score(), assessment.category(),
                assessment.estimatedResource(), decompose(itemId, title, estimate));
    }

    // ------------------------------------------------------------------
    // Decomposition
    // ------------------------------------------------------------------

    /**
     * Ask the decomposition agent for a split and validate it.
     *
     * A rejected split is re-requested once, with the violations as feedback.
     * A second rejection raises {@link DecompositionException}. Agent failures
     * propagate unchanged.
     */
    public DecompositionAdvice decompose(String itemId, String title, WorkItemEstimate estimate) {
        long maxChildScore    = thresholds.mediumMax();
        long maxChildResource = thresholds.ceiling();
        String feedback = null;
        List<String> violations = List.of();

        for (int attempt = 1; attempt <= 2; attempt++) {
            SplitRequest request = new SplitRequest(itemId, title, estimate, maxChildScore, maxChildResource, feedback);
            SplitResult result = agents.invoke(PhaseCapability.DECOMPOSITION, request, SplitResult.class);

            violations = validateSplit(estimate, result.children(), maxChildResource);
            if (violations.isEmpty()) {
                List<ScoredChild> children = result.children().stream()
                        .map(this::scoreChild)
                        .toList();
                log.info("Item {} decomposed into {} children (attempt {})", itemId, children.size(), attempt);
                return new DecompositionAdvice(children, result.rationale(), attempt);
            }
            log.warn("Split of item {} rejected (attempt {}): {}", itemId, attempt, violations);
            feedback = String.join("\n", violations);
        }
        throw new DecompositionException(itemId, violations);
    }

    /**
     * Reasons a proposed split is unacceptable; empty when it is valid.
     *
     * A split must have at least two children, each scoring below the
     * Complex threshold and fitting under the resource ceiling, together
     * covering at least the parent's lines of code, with blockedBy edges
     * that reference earlier-or-later siblings but never form a cycle.
     */
    List<String> validateSplit(WorkItemEstimate parent, List<ChildDraft> children, long maxChildResource) {
        List<String> violations = new ArrayList<>();
        if (children.size() < 2) {
            violations.add("A split needs at least two children, got " + children.size());
            return violations;
        }

        long coveredLoc = 0;
        for (int i = 0; i < children.size(); i++) {
            ChildDraft child = children.get(i);
            if (child.estimate() == null) {
                violations.add("Child %d (%s) has no estimate".formatted(i, child.title()));
                continue;
            }
            coveredLoc += child.estimate().loc();
            int score;
            try {
                score = score(child.estimate());
            } catch (IllegalArgumentException e) {
                violations.add("Child %d (%s): %s".formatted(i, child.title(), e.getMessage()));
                continue;
            }
            if (classify(score) == ComplexityCategory.COMPLEX) {
                violations.add("Child %d (%s) scores %d, above the Complex threshold %d"
                        .formatted(i, child.title(), score, thresholds.mediumMax()));
            }
            long resource = estimateResource(child.estimate());
            if (resource > maxChildResource) {
                violations.add("Child %d (%s) needs %d resource, above the ceiling %d"
                        .formatted(i, child.title(), resource, maxChildResource));
            }
            for (int blocker : child.blockedBy()) {
                if (blocker == i) {
                    violations.add("Child %d is blocked by itself".formatted(i));
                } else if (blocker < 0 || blocker >= children.size()) {
                    violations.add("Child %d is blocked by unknown child %d".formatted(i, blocker));
                }
            }
        }
        if (coveredLoc < parent.loc()) {
            violations.add("Children cover %d lines, the parent needs %d".formatted(coveredLoc, parent.loc()));
        }
        if (violations.isEmpty() && hasCycle(children)) {
            violations.add("blockedBy edges form a cycle");
        }
        return violations;
    }

    private ScoredChild scoreChild(ChildDraft child) {
        int score = score(child.estimate());
        return new ScoredChild(child.title(), child.estimate(), score, classify(score),
                estimateResource(child.estimate()), child.blockedBy());
    }

    // Kahn's algorithm over blockedBy edges.
    private static boolean hasCycle(List<ChildDraft> children) {
        int n = children.size();
        int[] indegree = new int[n];
        for (int i = 0; i < n; i++) {
            indegree[i] = children.get(i).blockedBy().size();
        }
        List<Integer> ready = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (indegree[i] == 0) ready.add(i);
        }
        int visited = 0;
        while (!ready.isEmpty()) {
            int done = ready.remove(ready.size() - 1);
            visited++;
            for (int i = 0; i < n; i++) {
                for (int blocker : children.get(i).blockedBy()) {
                    if (blocker == done && --indegree[i] == 0) {
                        ready.add(i);
                    }
                }
            }
        }
        return visited < n;
    }
}
