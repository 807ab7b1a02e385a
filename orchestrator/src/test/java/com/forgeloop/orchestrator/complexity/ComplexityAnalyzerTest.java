package com.forgeloop.orchestrator.complexity;

import com.forgeloop.orchestrator.agent.AgentCapabilityException;
import com.forgeloop.orchestrator.agent.AgentGateway;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.contract.ChildDraft;
import com.forgeloop.orchestrator.agent.contract.SplitRequest;
import com.forgeloop.orchestrator.agent.contract.SplitResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.config.TunableThresholds;
import com.forgeloop.orchestrator.model.ComplexityCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComplexityAnalyzerTest {

    @Mock AgentGateway agents;

    ForgeloopProperties properties;
    TunableThresholds   thresholds;
    ComplexityAnalyzer  analyzer;

    static final WorkItemEstimate COMPLEX_PARENT = new WorkItemEstimate(10, 800, 0);

    @BeforeEach
    void setUp() {
        properties = new ForgeloopProperties();
        thresholds = TunableThresholds.from(properties);
        analyzer   = new ComplexityAnalyzer(properties, thresholds, agents);
    }

    // ------------------------------------------------------------------
    // Scoring and classification
    // ------------------------------------------------------------------

    @Test
    void score_weightsFilesLinesAndDependencies() {
        assertThat(analyzer.score(new WorkItemEstimate(1, 100, 0))).isEqualTo(200);
        assertThat(analyzer.score(new WorkItemEstimate(5, 400, 0))).isEqualTo(900);
        assertThat(analyzer.score(new WorkItemEstimate(10, 800, 0))).isEqualTo(1800);
        assertThat(analyzer.score(new WorkItemEstimate(2, 50, 3))).isEqualTo(400);
    }

    @Test
    void score_estimateBeyondIntRange_rejected() {
        assertThatThrownBy(() -> analyzer.score(new WorkItemEstimate(Integer.MAX_VALUE, 0, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Estimate too large to score");
    }

    @Test
    void classify_boundariesAreInclusiveUpperBounds() {
        assertThat(analyzer.classify(0)).isEqualTo(ComplexityCategory.SIMPLE);
        assertThat(analyzer.classify(500)).isEqualTo(ComplexityCategory.SIMPLE);
        assertThat(analyzer.classify(501)).isEqualTo(ComplexityCategory.MEDIUM);
        assertThat(analyzer.classify(1500)).isEqualTo(ComplexityCategory.MEDIUM);
        assertThat(analyzer.classify(1501)).isEqualTo(ComplexityCategory.COMPLEX);
    }

    @Test
    void classify_negativeScore_rejected() {
        assertThatThrownBy(() -> analyzer.classify(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classify_followsApprovedThresholdChange() {
        thresholds.set(TunableThresholds.SIMPLE_MAX, 400);

        assertThat(analyzer.classify(450)).isEqualTo(ComplexityCategory.MEDIUM);
    }

    @Test
    void estimateResource_usesCostModel() {
        assertThat(analyzer.estimateResource(new WorkItemEstimate(1, 100, 0))).isEqualTo(25_000);
        assertThat(analyzer.estimateResource(new WorkItemEstimate(5, 400, 0))).isEqualTo(58_000);
        assertThat(analyzer.estimateResource(new WorkItemEstimate(10, 800, 0))).isEqualTo(101_000);
    }

    @Test
    void analyze_nonComplexItem_doesNotAskForSplit() {
        ComplexityAssessment assessment = analyzer.analyze("1", "Login form", new WorkItemEstimate(1, 100, 0));

        assertThat(assessment.category()).isEqualTo(ComplexityCategory.SIMPLE);
        assertThat(assessment.decompositionAdvice()).isNull();
        verifyNoInteractions(agents);
    }

    // ------------------------------------------------------------------
    // Decomposition
    // ------------------------------------------------------------------

    @Test
    void analyze_complexItem_returnsValidatedChildren() {
        when(agents.invoke(eq(PhaseCapability.DECOMPOSITION), any(SplitRequest.class), eq(SplitResult.class)))
                .thenReturn(split(List.of(), List.of(0)));

        ComplexityAssessment assessment = analyzer.analyze("3", "Reporting", COMPLEX_PARENT);

        assertThat(assessment.requiresDecomposition()).isTrue();
        DecompositionAdvice advice = assessment.decompositionAdvice();
        assertThat(advice.attempts()).isEqualTo(1);
        assertThat(advice.children()).hasSize(2)
                .allSatisfy(child -> {
                    assertThat(child.score()).isEqualTo(900);
                    assertThat(child.category()).isEqualTo(ComplexityCategory.MEDIUM);
                    assertThat(child.estimatedResource()).isEqualTo(58_000);
                });
        assertThat(advice.children().get(1).blockedBy()).containsExactly(0);
    }

    @Test
    void decompose_rejectedSplit_retriedOnceWithFeedback() {
        SplitResult tooBig = new SplitResult(List.of(
                new ChildDraft("All of it", new WorkItemEstimate(10, 700, 0), List.of()),
                new ChildDraft("Docs", new WorkItemEstimate(1, 100, 0), List.of())), "first try");
        when(agents.invoke(eq(PhaseCapability.DECOMPOSITION), any(SplitRequest.class), eq(SplitResult.class)))
                .thenReturn(tooBig)
                .thenReturn(split(List.of(), List.of()));

        DecompositionAdvice advice = analyzer.decompose("3", "Reporting", COMPLEX_PARENT);

        assertThat(advice.attempts()).isEqualTo(2);
        ArgumentCaptor<SplitRequest> requests = ArgumentCaptor.forClass(SplitRequest.class);
        verify(agents, times(2)).invoke(eq(PhaseCapability.DECOMPOSITION), requests.capture(), eq(SplitResult.class));
        assertThat(requests.getAllValues().get(0).feedback()).isNull();
        assertThat(requests.getAllValues().get(1).feedback()).contains("above the Complex threshold");
        assertThat(requests.getAllValues().get(1).maxChildScore()).isEqualTo(1500);
    }

    @Test
    void decompose_twoRejectedSplits_throwDecompositionException() {
        SplitResult single = new SplitResult(List.of(
                new ChildDraft("Everything", COMPLEX_PARENT, List.of())), "no split");
        when(agents.invoke(eq(PhaseCapability.DECOMPOSITION), any(SplitRequest.class), eq(SplitResult.class)))
                .thenReturn(single);

        assertThatThrownBy(() -> analyzer.decompose("3", "Reporting", COMPLEX_PARENT))
                .isInstanceOf(DecompositionException.class)
                .satisfies(e -> {
                    DecompositionException de = (DecompositionException) e;
                    assertThat(de.getItemId()).isEqualTo("3");
                    assertThat(de.getViolations()).singleElement().asString().contains("at least two children");
                });
        verify(agents, times(2)).invoke(eq(PhaseCapability.DECOMPOSITION), any(SplitRequest.class), eq(SplitResult.class));
    }

    @Test
    void decompose_agentFailure_propagates() {
        when(agents.invoke(eq(PhaseCapability.DECOMPOSITION), any(SplitRequest.class), eq(SplitResult.class)))
                .thenThrow(new AgentCapabilityException(AgentCapabilityException.Kind.UNAVAILABLE,
                        PhaseCapability.DECOMPOSITION, "timeout"));

        assertThatThrownBy(() -> analyzer.decompose("3", "Reporting", COMPLEX_PARENT))
                .isInstanceOf(AgentCapabilityException.class);
    }

    @Test
    void validateSplit_cycle_rejected() {
        List<String> violations = analyzer.validateSplit(COMPLEX_PARENT, split(List.of(1), List.of(0)).children(), 150_000);

        assertThat(violations).containsExactly("blockedBy edges form a cycle");
    }

    @Test
    void validateSplit_selfEdgeAndUnknownSibling_rejected() {
        List<String> violations = analyzer.validateSplit(COMPLEX_PARENT, split(List.of(0), List.of(5)).children(), 150_000);

        assertThat(violations).containsExactly(
                "Child 0 is blocked by itself",
                "Child 1 is blocked by unknown child 5");
    }

    @Test
    void validateSplit_unscorableChild_reportedAsViolation() {
        List<ChildDraft> children = List.of(
                new ChildDraft("Reporting: everything", new WorkItemEstimate(Integer.MAX_VALUE, 800, 0), List.of()),
                new ChildDraft("Reporting: export", new WorkItemEstimate(5, 400, 0), List.of()));

        assertThat(analyzer.validateSplit(COMPLEX_PARENT, children, 150_000))
                .singleElement().asString()
                .startsWith("Child 0 (Reporting: everything): Estimate too large to score");
    }

    @Test
    void validateSplit_childrenCoverTooFewLines_rejected() {
        List<ChildDraft> children = List.of(
                new ChildDraft("A", new WorkItemEstimate(2, 200, 0), List.of()),
                new ChildDraft("B", new WorkItemEstimate(2, 200, 0), List.of()));

        assertThat(analyzer.validateSplit(COMPLEX_PARENT, children, 150_000))
                .containsExactly("Children cover 400 lines, the parent needs 800");
    }

    // ------------------------------------------------------------------

    private static SplitResult split(List<Integer> firstBlockedBy, List<Integer> secondBlockedBy) {
        return new SplitResult(List.of(
                new ChildDraft("Reporting: queries", new WorkItemEstimate(5, 400, 0), firstBlockedBy),
                new ChildDraft("Reporting: export", new WorkItemEstimate(5, 400, 0), secondBlockedBy)),
                "split by layer");
    }
}
