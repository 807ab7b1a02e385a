package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.agent.AgentCapabilityException;
import com.forgeloop.orchestrator.agent.AgentGateway;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.contract.ArchitectureRequest;
import com.forgeloop.orchestrator.agent.contract.ArchitectureResult;
import com.forgeloop.orchestrator.agent.contract.DefinitionResult;
import com.forgeloop.orchestrator.agent.contract.ImplementationRequest;
import com.forgeloop.orchestrator.agent.contract.ImplementationResult;
import com.forgeloop.orchestrator.agent.contract.InfraResult;
import com.forgeloop.orchestrator.agent.contract.ItemDraft;
import com.forgeloop.orchestrator.agent.contract.LearningRequest;
import com.forgeloop.orchestrator.agent.contract.LearningResult;
import com.forgeloop.orchestrator.agent.contract.ProjectBrief;
import com.forgeloop.orchestrator.agent.contract.QaRequest;
import com.forgeloop.orchestrator.agent.contract.QaResult;
import com.forgeloop.orchestrator.agent.contract.TestOutcome;
import com.forgeloop.orchestrator.agent.contract.VerificationRequest;
import com.forgeloop.orchestrator.agent.contract.VerificationResult;
import com.forgeloop.orchestrator.checkpoint.CheckpointException;
import com.forgeloop.orchestrator.checkpoint.CheckpointStore;
import com.forgeloop.orchestrator.complexity.ComplexityAnalyzer;
import com.forgeloop.orchestrator.complexity.ComplexityAssessment;
import com.forgeloop.orchestrator.complexity.DecompositionAdvice;
import com.forgeloop.orchestrator.complexity.DecompositionException;
import com.forgeloop.orchestrator.complexity.ScoredChild;
import com.forgeloop.orchestrator.complexity.WorkItemEstimate;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.history.ProjectHistoryService;
import com.forgeloop.orchestrator.model.AgentInvocation;
import com.forgeloop.orchestrator.model.ApprovalDecision;
import com.forgeloop.orchestrator.model.ApprovalKind;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.ComplexityCategory;
import com.forgeloop.orchestrator.model.Disclosure;
import com.forgeloop.orchestrator.model.ItemState;
import com.forgeloop.orchestrator.model.PendingApproval;
import com.forgeloop.orchestrator.model.PhaseId;
import com.forgeloop.orchestrator.model.PhaseStatus;
import com.forgeloop.orchestrator.model.Priority;
import com.forgeloop.orchestrator.model.VerificationFailure;
import com.forgeloop.orchestrator.model.VerificationState;
import com.forgeloop.orchestrator.model.WorkItem;
import com.forgeloop.orchestrator.model.WorkItemKind;
import com.forgeloop.orchestrator.resume.ResumptionPoint;
import com.forgeloop.orchestrator.tracker.ItemFilter;
import com.forgeloop.orchestrator.tracker.ItemSummary;
import com.forgeloop.orchestrator.tracker.TrackerException;
import com.forgeloop.orchestrator.tracker.TrackerLabels;
import com.forgeloop.orchestrator.tracker.WorkItemTracker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The orchestration core: drives a project through its phases.
 *
 * <pre>
 *   0 INFRA → 1 DEFINITION → 1.5 DECOMPOSITION → 2 ARCHITECTURE
 *     → 3 IMPLEMENTATION ⇄ 4 QA → 5 VERIFICATION → 6 LEARNING → DONE
 *                 ↑__________________________|  (bounded retries)
 *                                            ↓
 *                                       DIVERGENCE (operator approval to exit)
 * </pre>
 *
 * Every unit of work follows the same commit order:
 * <ol>
 *   <li>Call the agent. Nothing is written before the call, so an
 *       interrupted call is simply made again on resume.</li>
 *   <li>Record the outcome with one {@link CheckpointStore#mutate} (cost,
 *       completion, the invocation log entry).</li>
 *   <li>Mirror it to the tracker (close the item).</li>
 * </ol>
 * A crash between 2 and 3 leaves the tracker behind the checkpoint; the
 * tracker wins at reconciliation and the unit is redone.
 *
 * Agent and tracker failures suspend the run with the checkpoint as last
 * written. Structural problems (a decomposition that cannot be made valid,
 * a phase predicate that does not hold) fail the run with a report.
 */
@Service
public class PhaseStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PhaseStateMachine.class);

    private final CheckpointStore       store;
    private final AgentGateway          agents;
    private final WorkItemTracker       tracker;
    private final ComplexityAnalyzer    analyzer;
    private final BudgetLadder          ladder;
    private final ResourceLedger        ledger;
    private final VerificationPolicy    verificationPolicy;
    private final TimeBudgetMonitor     timeMonitor;
    private final ProjectHistoryService history;
    private final ForgeloopProperties   properties;
    private final Clock                 clock;
    private final MeterRegistry         meterRegistry;

    public PhaseStateMachine(CheckpointStore store,
                             AgentGateway agents,
                             WorkItemTracker tracker,
                             ComplexityAnalyzer analyzer,
                             BudgetLadder ladder,
                             ResourceLedger ledger,
                             VerificationPolicy verificationPolicy,
                             TimeBudgetMonitor timeMonitor,
                             ProjectHistoryService history,
                             ForgeloopProperties properties,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.store              = store;
        this.agents             = agents;
        this.tracker            = tracker;
        this.analyzer           = analyzer;
        this.ladder             = ladder;
        this.ledger             = ledger;
        this.verificationPolicy = verificationPolicy;
        this.timeMonitor        = timeMonitor;
        this.history            = history;
        this.properties         = properties;
        this.clock              = clock;
        this.meterRegistry      = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Run loop
    // ------------------------------------------------------------------

    /** Re-enter at a point produced by ResumeController. */
    public RunResult run(ResumptionPoint point) {
        log.info("Re-entering at phase {} (item={}, verificationAttempt={})",
                point.phase().number(), point.itemId(), point.verificationAttempt());
        return run();
    }

    /**
     * Drive the checkpoint forward until the run completes or a stop
     * condition is met. Safe to call repeatedly: every step starts from the
     * stored checkpoint.
     *
     * @throws ApprovalRequiredException       if an approval gate is open
     * @throws VerificationDivergenceException if the run is in divergence
     */
    public RunResult run() {
        Checkpoint cp = load();
        MDC.put("project", cp.getProject().getName());
        try {
            guardRunnable(cp);
            if (cp.getPhase().getStatus() == PhaseStatus.NOT_STARTED) {
                store.mutate(c -> {
                    c.getVerification().setMaxAttempts(properties.getVerification().getMaxAttempts());
                    c.getPhase().enter(PhaseId.PHASE_0_INFRA, clock.instant());
                    c.setResumeHint(hint(PhaseId.PHASE_0_INFRA));
                    return c;
                });
            }

            while (true) {
                cp = load();
                PhaseId phase = cp.getPhase().getCurrent();
                MDC.put("phase", phase.number());
                if (phase == PhaseId.DONE) {
                    String report = RunReports.finalReport(cp);
                    log.info("Run complete\n{}", report);
                    return RunResult.of(RunOutcome.COMPLETED, PhaseId.DONE, report);
                }
                RunResult stop = checkGates(cp);
                if (stop != null) return stop;

                RunResult result = switch (phase) {
                    case PHASE_0_INFRA           -> runInfrastructure(cp);
                    case PHASE_1_DEFINITION      -> runDefinition(cp);
                    case PHASE_1_5_DECOMPOSITION -> runDecomposition(cp);
                    case PHASE_2_ARCHITECTURE    -> runArchitecture(cp);
                    case PHASE_3_IMPLEMENTATION  -> runImplementation();
                    case PHASE_4_QA              -> runQa(cp);
                    case PHASE_5_VERIFICATION    -> runVerification(cp);
                    case PHASE_6_LEARNING        -> runLearning(cp);
                    case DONE                    -> null;
                };
                if (result != null) return result;
            }

        } catch (AgentCapabilityException | TrackerException e) {
            Checkpoint last = load();
            String report = RunReports.suspended(last, e.getMessage());
            log.warn("Run suspended: {}", e.getMessage());
            return new RunResult(RunOutcome.SUSPENDED, last.getPhase().getCurrent(),
                    last.getWorkProgress().getInProgressItem(), report);

        } catch (DecompositionException | PhaseTransitionException e) {
            Checkpoint last = load();
            log.error("Run halted: {}", e.getMessage());
            return RunResult.of(RunOutcome.FAILED, last.getPhase().getCurrent(), "HALTED: " + e.getMessage());

        } finally {
            MDC.remove("project");
            MDC.remove("phase");
            MDC.remove("itemId");
        }
    }

    private void guardRunnable(Checkpoint cp) {
        if (cp.getPhase().getStatus() == PhaseStatus.DIVERGENCE) {
            throw new VerificationDivergenceException(cp.getVerification().getAttemptCount(), RunReports.divergence(cp));
        }
        PendingApproval gate = cp.getPendingApproval();
        if (gate != null) {
            throw new ApprovalRequiredException(gate.getKind(),
                    "Approval pending for phase " + gate.getPhase().number() + ": " + gate.getReason());
        }
    }

    /** Time budget and session budget, checked at phase boundaries and loop iterations. */
    private RunResult checkGates(Checkpoint cp) {
        if (timeMonitor.exceeded(cp.getPhase())) {
            return openTimeGate(cp);
        }
        if (cp.getResourceTracking().isThresholdExceeded()) {
            String report = RunReports.sessionBudget(cp.getResourceTracking());
            log.warn("Session budget warning threshold passed, stopping at item boundary");
            return RunResult.of(RunOutcome.SESSION_BUDGET_REACHED, cp.getPhase().getCurrent(), report);
        }
        return null;
    }

    private RunResult openTimeGate(Checkpoint cp) {
        String elapsed = timeMonitor.elapsed(cp.getPhase()).toString();
        String budget  = timeMonitor.budgetFor(cp.getPhase()).toString();
        String report  = RunReports.timeBudget(cp, elapsed, budget);
        PhaseId phase  = cp.getPhase().getCurrent();
        store.mutate(c -> {
            c.setPendingApproval(new PendingApproval(ApprovalKind.TIME_BUDGET, phase,
                    "elapsed " + elapsed + " over budget " + budget, clock.instant()));
            c.getPhase().setStatus(PhaseStatus.AWAITING_APPROVAL);
            c.setResumeHint("Answer the time-budget gate of phase " + phase.number());
            return c;
        });
        log.warn("Time budget exceeded in phase {}; waiting for approval", phase.number());
        return RunResult.of(RunOutcome.AWAITING_APPROVAL, phase, report);
    }

    // ------------------------------------------------------------------
    // Phase 0-2
    // ------------------------------------------------------------------

    private RunResult runInfrastructure(Checkpoint cp) {
        Instant started = clock.instant();
        InfraResult result = agents.invoke(PhaseCapability.INFRA_SETUP, brief(cp), InfraResult.class);
        store.mutate(c -> {
            c.recordArtifacts(PhaseId.PHASE_0_INFRA, result.artifacts());
            logInvocation(c, PhaseCapability.INFRA_SETUP, null, started);
            advance(c, PhaseId.PHASE_0_INFRA);
            return c;
        });
        return null;
    }

    /** Assess an estimate taken from agent output; one that cannot be scored is malformed output. */
    private ComplexityAssessment assessDraft(PhaseCapability source, String title, WorkItemEstimate estimate) {
        try {
            return analyzer.assess(estimate);
        } catch (IllegalArgumentException e) {
            throw new AgentCapabilityException(AgentCapabilityException.Kind.MALFORMED_OUTPUT, source,
                    "Item '" + title + "': " + e.getMessage(), e);
        }
    }

    private RunResult runDefinition(Checkpoint cp) {
        Instant started = clock.instant();
        DefinitionResult result = agents.invoke(PhaseCapability.PRODUCT_DEFINITION, brief(cp), DefinitionResult.class);

        Map<String, String> existing = unrecordedByTitle(cp);
        Map<String, String> idsByTitle = new HashMap<>();
        List<WorkItem> items = new ArrayList<>();
        for (ItemDraft draft : result.items()) {
            ComplexityAssessment assessment = assessDraft(PhaseCapability.PRODUCT_DEFINITION, draft.title(), draft.estimate());
            String id = findOrCreate(existing, draft.title(), draft.body(),
                    TrackerLabels.forItem(name(cp), draft.kind(), draft.priority(), assessment.category()));
            items.add(scoredItem(id, draft.title(), draft.kind(), draft.priority(), draft.estimate(), assessment));
            idsByTitle.put(draft.title(), id);
        }
        for (int i = 0; i < items.size(); i++) {
            for (String dependency : result.items().get(i).dependsOnTitles()) {
                String depId = idsByTitle.get(dependency);
                if (depId == null) {
                    log.warn("Item '{}' depends on unknown item '{}', ignoring", items.get(i).getTitle(), dependency);
                } else if (!depId.equals(items.get(i).getId())) {
                    items.get(i).getDependsOn().add(depId);
                }
            }
        }

        store.mutate(c -> {
            items.forEach(item -> addItem(c, item));
            if (result.prdArtifact() != null) {
                c.recordArtifacts(PhaseId.PHASE_1_DEFINITION, List.of(result.prdArtifact()));
            }
            logInvocation(c, PhaseCapability.PRODUCT_DEFINITION, null, started);
            advance(c, PhaseId.PHASE_1_DEFINITION);
            return c;
        });
        log.info("Defined {} work items", items.size());
        return null;
    }

    private RunResult runDecomposition(Checkpoint cp) {
        for (String itemId : List.copyOf(cp.getWorkProgress().getOpenItems())) {
            Checkpoint current = load();
            WorkItem item = current.getWorkItems().get(itemId);
            if (item == null || PhasePredicates.awaitsTriage(current, item) || item.isUmbrella()
                    || item.getComplexityCategory() != ComplexityCategory.COMPLEX) {
                continue;
            }
            if (timeMonitor.exceeded(current.getPhase())) {
                return openTimeGate(current);
            }
            decomposeItem(current, item);
        }
        store.mutate(c -> {
            advance(c, PhaseId.PHASE_1_5_DECOMPOSITION);
            return c;
        });
        return null;
    }

    private RunResult runArchitecture(Checkpoint cp) {
        List<String> titles = cp.getWorkItems().values().stream()
                .filter(item -> !PhasePredicates.awaitsTriage(cp, item))
                .map(WorkItem::getTitle)
                .toList();
        Instant started = clock.instant();
        ArchitectureResult result = agents.invoke(PhaseCapability.ARCHITECTURE,
                new ArchitectureRequest(brief(cp), titles), ArchitectureResult.class);
        store.mutate(c -> {
            if (result.designArtifact() != null) {
                c.recordArtifacts(PhaseId.PHASE_2_ARCHITECTURE, List.of(result.designArtifact()));
            }
            logInvocation(c, PhaseCapability.ARCHITECTURE, null, started);
            advance(c, PhaseId.PHASE_2_ARCHITECTURE);
            return c;
        });
        return null;
    }

    /**
     * Split a COMPLEX (or over-ceiling) item into validated children. The
     * parent stays open as an umbrella and is closed once every child is done.
     */
    private void decomposeItem(Checkpoint cp, WorkItem parent) {
        Instant started = clock.instant();
        DecompositionAdvice advice = analyzer.decompose(parent.getId(), parent.getTitle(), parent.getEstimate());

        Map<String, String> existing = unrecordedByTitle(cp);
        List<String> childIds = new ArrayList<>();
        for (ScoredChild child : advice.children()) {
            childIds.add(findOrCreate(existing, child.title(), "Part of #" + parent.getId(),
                    TrackerLabels.forItem(name(cp), parent.getKind(), parent.getPriority(), child.category())));
        }

        store.mutate(c -> {
            WorkItem p = c.item(parent.getId());
            for (int i = 0; i < childIds.size(); i++) {
                ScoredChild child = advice.children().get(i);
                WorkItem item = new WorkItem(childIds.get(i), child.title(), p.getKind(), p.getPriority());
                item.setEstimate(child.estimate());
                item.setComplexityScore(child.score());
                item.setComplexityCategory(child.category());
                item.setEstimatedResource(child.estimatedResource());
                item.setParentId(p.getId());
                item.getDependsOn().addAll(p.getDependsOn());
                for (int blocker : child.blockedBy()) {
                    item.getDependsOn().add(childIds.get(blocker));
                }
                addItem(c, item);
            }
            p.setChildren(new ArrayList<>(childIds));
            logInvocation(c, PhaseCapability.DECOMPOSITION, p.getId(), started);
            return c;
        });
        tracker.comment(parent.getId(), "Decomposed into " + childIds.stream()
                .map(id -> "#" + id).collect(Collectors.joining(", ")) + ". " + nullToEmpty(advice.rationale()));
    }

    // ------------------------------------------------------------------
    // Phase 3: implementation sub-loop
    // ------------------------------------------------------------------

    private RunResult runImplementation() {
        while (true) {
            Checkpoint cp = closeFinishedUmbrellas(load());
            RunResult stop = checkGates(cp);
            if (stop != null) return stop;

            Optional<WorkItem> next = selectNext(cp);
            if (next.isEmpty()) {
                if (!PhasePredicates.isComplete(PhaseId.PHASE_3_IMPLEMENTATION, cp)) {
                    throw new PhaseTransitionException(PhaseId.PHASE_3_IMPLEMENTATION,
                            "no open item can be scheduled; dependencies never complete for "
                                    + cp.getWorkProgress().getOpenItems());
                }
                store.mutate(c -> {
                    advance(c, PhaseId.PHASE_3_IMPLEMENTATION);
                    return c;
                });
                return null;
            }

            WorkItem item = next.get();
            MDC.put("itemId", item.getId());
            SchedulingPlan plan;
            try {
                plan = ladder.plan(item);
            } catch (ResourceCeilingExceededException e) {
                log.warn("{}; routing to decomposition", e.getMessage());
                MDC.remove("itemId");
                decomposeItem(cp, item);
                continue;
            }
            implementItem(item.getId(), plan);
            MDC.remove("itemId");
        }
    }

    /**
     * Next item to implement: the in-progress item if it is still schedulable,
     * otherwise the highest-priority open item whose dependencies are done.
     * Ties keep creation order.
     */
    Optional<WorkItem> selectNext(Checkpoint cp) {
        Set<String> completed = cp.getWorkProgress().getCompletedItems();
        List<WorkItem> ready = cp.getWorkProgress().getOpenItems().stream()
                .map(cp.getWorkItems()::get)
                .filter(item -> item != null && !item.isUmbrella() && !PhasePredicates.awaitsTriage(cp, item))
                .filter(item -> item.getDependsOn().stream()
                        .allMatch(dep -> completed.contains(dep) || !cp.getWorkItems().containsKey(dep)))
                .toList();

        String inProgress = cp.getWorkProgress().getInProgressItem();
        for (WorkItem item : ready) {
            if (item.getId().equals(inProgress)) return Optional.of(item);
        }
        return ready.stream().max(Comparator.comparingInt((WorkItem item) -> item.getPriority().rank())
                .thenComparingInt(item -> -ready.indexOf(item)));
    }

    private void implementItem(String itemId, SchedulingPlan plan) {
        int maxSubUnits = plan.plannedSubUnits() + properties.getBudget().getMaxExtraSubUnits();
        while (true) {
            Checkpoint cp = load();
            WorkItem item = cp.item(itemId);
            ImplementationRequest request = new ImplementationRequest(itemId, item.getTitle(),
                    item.getSubUnitsUsed() + 1, plan.plannedSubUnits(),
                    List.copyOf(cp.getArtifacts()), item.getFocus());

            Instant started = clock.instant();
            ImplementationResult result = agents.invoke(PhaseCapability.IMPLEMENTATION, request,
                    ImplementationResult.class);

            Checkpoint after = store.mutate(c -> {
                WorkItem w = c.item(itemId);
                ledger.trackResourceUsage(c.getResourceTracking(), result.cost());
                w.setActualResource(w.getActualResource() + result.cost());
                w.setSubUnitsUsed(w.getSubUnitsUsed() + 1);
                c.getArtifacts().addAll(result.artifacts());
                logInvocation(c, PhaseCapability.IMPLEMENTATION, itemId, started);
                if (result.itemComplete()) {
                    w.setState(ItemState.CLOSED);
                    c.getWorkProgress().markCompleted(itemId);
                    c.setResumeHint(hint(PhaseId.PHASE_3_IMPLEMENTATION));
                } else {
                    c.getWorkProgress().setInProgressItem(itemId);
                    c.setResumeHint("Continue item #%s at sub-unit %d".formatted(itemId, w.getSubUnitsUsed() + 1));
                }
                return c;
            });

            if (result.itemComplete()) {
                tracker.closeItem(itemId, evidence(result));
                log.info("Item {} complete after {} sub-unit(s)", itemId, after.item(itemId).getSubUnitsUsed());
                return;
            }

            WorkItem w = after.item(itemId);
            boolean overCeiling = ledger.itemOverCeiling(w);
            boolean overPlan    = w.getSubUnitsUsed() >= maxSubUnits;
            if (overCeiling || overPlan) {
                log.warn("Item {} stopped mid-item ({} used, ceiling {}, {} sub-units); splitting remainder",
                        itemId, w.getActualResource(), ledger.itemCeiling(), w.getSubUnitsUsed());
                splitRemainder(after, w, result.remainingEstimate(), !overCeiling);
                return;
            }
        }
    }

    /**
     * Close an item as partial and move what is left into a new item that
     * depends on it. Items that depended on the original now also wait for
     * the remainder.
     */
    private void splitRemainder(Checkpoint cp, WorkItem original, WorkItemEstimate remaining, boolean flag) {
        WorkItemEstimate estimate = remaining != null ? remaining : original.getEstimate();
        ComplexityAssessment assessment = analyzer.assess(estimate);
        String title = original.getTitle() + " (remainder)";
        String remainderId = findOrCreate(unrecordedByTitle(cp), title, "Remainder of #" + original.getId(),
                TrackerLabels.forItem(name(cp), original.getKind(), original.getPriority(), assessment.category()));

        store.mutate(c -> {
            WorkItem orig = c.item(original.getId());
            WorkItem rest = scoredItem(remainderId, title, orig.getKind(), orig.getPriority(), estimate, assessment);
            rest.getDependsOn().add(orig.getId());
            rest.setFocus(orig.getFocus());
            rest.setParentId(orig.getParentId());
            if (orig.getParentId() != null) {
                WorkItem parent = c.getWorkItems().get(orig.getParentId());
                if (parent != null && !parent.getChildren().contains(remainderId)) {
                    parent.getChildren().add(remainderId);
                }
            }
            for (WorkItem other : c.getWorkItems().values()) {
                if (other.getDependsOn().contains(orig.getId()) && other.getState() == ItemState.OPEN) {
                    other.getDependsOn().add(remainderId);
                }
            }
            orig.setSplitMidItem(true);
            orig.setState(ItemState.CLOSED);
            c.getWorkProgress().markCompleted(orig.getId());
            addItem(c, rest);
            if (flag) {
                c.getWorkProgress().getFlaggedItems().add(remainderId);
            }
            return c;
        });
        tracker.closeItem(original.getId(), "Closed as partial after %d resource; remainder continues in #%s"
                .formatted(original.getActualResource(), remainderId));
    }

    private Checkpoint closeFinishedUmbrellas(Checkpoint cp) {
        Set<String> completed = cp.getWorkProgress().getCompletedItems();
        List<String> finished = cp.getWorkProgress().getOpenItems().stream()
                .map(cp.getWorkItems()::get)
                .filter(item -> item != null && item.isUmbrella())
                .filter(item -> item.getChildren().stream()
                        .allMatch(child -> completed.contains(child) || !cp.getWorkItems().containsKey(child)))
                .map(WorkItem::getId)
                .toList();
        if (finished.isEmpty()) {
            return cp;
        }
        Checkpoint updated = store.mutate(c -> {
            for (String id : finished) {
                c.item(id).setState(ItemState.CLOSED);
                c.getWorkProgress().markCompleted(id);
            }
            return c;
        });
        for (String id : finished) {
            tracker.closeItem(id, "All child items complete: " + cp.item(id).getChildren().stream()
                    .map(child -> "#" + child).collect(Collectors.joining(", ")));
        }
        return updated;
    }

    // ------------------------------------------------------------------
    // Phase 4-6
    // ------------------------------------------------------------------

    private RunResult runQa(Checkpoint cp) {
        List<String> completedTitles = cp.getWorkProgress().getCompletedItems().stream()
                .map(cp.getWorkItems()::get)
                .filter(item -> item != null && !item.isUmbrella())
                .map(WorkItem::getTitle)
                .toList();
        Instant started = clock.instant();
        QaResult result = agents.invoke(PhaseCapability.QA, new QaRequest(name(cp), completedTitles), QaResult.class);

        Map<String, String> existing = unrecordedByTitle(cp);
        List<WorkItem> bugs = new ArrayList<>();
        for (ItemDraft draft : result.bugs()) {
            WorkItemEstimate estimate = draft.estimate() != null ? draft.estimate()
                    : new WorkItemEstimate(1, properties.getVerification().getFixLocPerTest(), 0);
            ComplexityAssessment assessment = assessDraft(PhaseCapability.QA, draft.title(), estimate);
            String id = findOrCreate(existing, draft.title(), draft.body(),
                    TrackerLabels.forItem(name(cp), WorkItemKind.BUG, draft.priority(), assessment.category()));
            bugs.add(scoredItem(id, draft.title(), WorkItemKind.BUG, draft.priority(), estimate, assessment));
        }

        store.mutate(c -> {
            bugs.forEach(bug -> addItem(c, bug));
            logInvocation(c, PhaseCapability.QA, null, started);
            if (bugs.isEmpty()) {
                advance(c, PhaseId.PHASE_4_QA);
            } else {
                c.getPhase().enter(PhaseId.PHASE_3_IMPLEMENTATION, clock.instant());
                c.setResumeHint("QA found %d bug(s); back to phase 3".formatted(bugs.size()));
            }
            return c;
        });
        if (!bugs.isEmpty()) {
            log.info("QA found {} bug(s), returning to implementation", bugs.size());
        }
        return null;
    }

    private RunResult runVerification(Checkpoint cp) {
        VerificationState state = cp.getVerification();
        int attempt = Math.min(Math.max(1, state.getAttemptCount()), state.getMaxAttempts());
        Set<String> skipped = new LinkedHashSet<>(state.getExcludedTests());
        cp.getDisclosures().stream()
                .filter(d -> d.getType() == Disclosure.Type.QUARANTINED_TEST)
                .forEach(d -> skipped.add(d.getDetail()));

        Instant started = clock.instant();
        VerificationResult result = agents.invoke(PhaseCapability.VERIFICATION,
                new VerificationRequest(name(cp), attempt, skipped), VerificationResult.class);
        VerificationVerdict verdict = verificationPolicy.evaluate(result, state, attempt);
        List<String> failingNow = result.failures().stream()
                .map(TestOutcome::name)
                .filter(test -> !state.getExcludedTests().contains(test))
                .toList();
        Instant now = clock.instant();

        if (verdict.passed()) {
            meterRegistry.counter("forgeloop.verification.attempts", "outcome", "passed").increment();
            store.mutate(c -> {
                recordAttempt(c, verdict, result, attempt, started, now);
                c.getVerification().setAttemptCount(0);
                advance(c, PhaseId.PHASE_5_VERIFICATION);
                return c;
            });
            log.info("Verification passed on attempt {}", attempt);
            return null;
        }

        VerificationFailure failure = new VerificationFailure(attempt, verdict.message(), now, failingNow);
        if (attempt < state.getMaxAttempts()) {
            meterRegistry.counter("forgeloop.verification.attempts", "outcome", "failed").increment();
            List<WorkItem> fixes = createFixItems(cp, verdict, result, attempt);
            store.mutate(c -> {
                recordAttempt(c, verdict, result, attempt, started, now);
                c.getVerification().getFailureHistory().add(failure);
                c.getVerification().setAttemptCount(attempt + 1);
                fixes.forEach(fix -> addItem(c, fix));
                c.getPhase().enter(PhaseId.PHASE_3_IMPLEMENTATION, clock.instant());
                c.setResumeHint("Verification attempt %d failed; fixing %d item(s) in phase 3"
                        .formatted(attempt, fixes.size()));
                return c;
            });
            log.warn("Verification attempt {}/{} failed: {}", attempt, state.getMaxAttempts(), verdict.message());
            return null;
        }

        meterRegistry.counter("forgeloop.verification.attempts", "outcome", "diverged").increment();
        Checkpoint diverged = store.mutate(c -> {
            recordAttempt(c, verdict, result, attempt, started, now);
            c.getVerification().getFailureHistory().add(failure);
            c.getVerification().setAttemptCount(attempt);
            c.getPhase().setStatus(PhaseStatus.DIVERGENCE);
            c.setPendingApproval(new PendingApproval(ApprovalKind.DIVERGENCE, PhaseId.PHASE_5_VERIFICATION,
                    verdict.message(), now));
            c.setResumeHint("Divergence: choose NARROW_SCOPE, RELAX_THRESHOLD or MANUAL_INTERVENTION");
            return c;
        });
        String report = RunReports.divergence(diverged);
        log.error("Verification diverged after {} attempts\n{}", attempt, report);
        return RunResult.of(RunOutcome.DIVERGENCE, PhaseId.PHASE_5_VERIFICATION, report);
    }

    private void recordAttempt(Checkpoint c, VerificationVerdict verdict, VerificationResult result,
                               int attempt, Instant started, Instant now) {
        logInvocation(c, PhaseCapability.VERIFICATION, null, started);
        c.getVerification().setLastAttemptAt(now);
        c.getVerification().setLastCoverage(result.coveragePercent());
        for (String test : verdict.quarantined()) {
            disclose(c, Disclosure.Type.QUARANTINED_TEST, test, attempt);
        }
        if (verdict.coverageGap() != null) {
            disclose(c, Disclosure.Type.COVERAGE_GAP, "coverage %.1f%% accepted against target %.1f%%"
                    .formatted(verdict.coverageGap(), verificationPolicy.coverageTarget(c.getVerification())), attempt);
        }
    }

    /**
     * One BUG item per work item with failing tests, one for failures that
     * name no item, and one for a coverage shortfall. Titles carry the attempt
     * number so a replayed attempt finds the items it already created.
     */
    private List<WorkItem> createFixItems(Checkpoint cp, VerificationVerdict verdict,
                                          VerificationResult result, int attempt) {
        Map<String, List<TestOutcome>> byItem = new LinkedHashMap<>();
        for (TestOutcome test : verdict.hardFailures()) {
            byItem.computeIfAbsent(test.itemId() == null ? "" : test.itemId(), k -> new ArrayList<>()).add(test);
        }
        Map<String, String> existing = unrecordedByTitle(cp);
        int locPerTest = properties.getVerification().getFixLocPerTest();
        List<WorkItem> fixes = new ArrayList<>();

        for (Map.Entry<String, List<TestOutcome>> group : byItem.entrySet()) {
            String title = group.getKey().isEmpty()
                    ? "Fix unattributed failing tests (verification attempt %d)".formatted(attempt)
                    : "Fix failing tests for #%s (verification attempt %d)".formatted(group.getKey(), attempt);
            String focus = group.getValue().stream()
                    .map(t -> t.name() + (t.message() == null ? "" : ": " + t.message()))
                    .collect(Collectors.joining("\n"));
            fixes.add(fixItem(cp, existing, title, focus,
                    new WorkItemEstimate(1, locPerTest * group.getValue().size(), 0)));
        }
        if (verdict.coverageFailure()) {
            String title = "Raise coverage to %.0f%% (verification attempt %d)"
                    .formatted(verificationPolicy.coverageTarget(cp.getVerification()), attempt);
            fixes.add(fixItem(cp, existing, title, "coverage is %.1f%%".formatted(result.coveragePercent()),
                    new WorkItemEstimate(1, locPerTest, 0)));
        }
        return fixes;
    }

    private WorkItem fixItem(Checkpoint cp, Map<String, String> existing, String title, String focus,
                             WorkItemEstimate estimate) {
        ComplexityAssessment assessment = analyzer.assess(estimate);
        String id = findOrCreate(existing, title, focus,
                TrackerLabels.forItem(name(cp), WorkItemKind.BUG, Priority.HIGH, assessment.category()));
        WorkItem fix = scoredItem(id, title, WorkItemKind.BUG, Priority.HIGH, estimate, assessment);
        fix.setFocus(focus);
        return fix;
    }

    private RunResult runLearning(Checkpoint cp) {
        List<String> disclosures = cp.getDisclosures().stream()
                .map(d -> d.getType() + ": " + d.getDetail())
                .toList();
        Instant started = clock.instant();
        LearningResult result = agents.invoke(PhaseCapability.LEARNING,
                new LearningRequest(name(cp), RunReports.finalReport(cp), disclosures), LearningResult.class);
        history.recordCompletedProject(cp);
        store.mutate(c -> {
            logInvocation(c, PhaseCapability.LEARNING, null, started);
            advance(c, PhaseId.PHASE_6_LEARNING);
            return c;
        });
        log.info("Learning phase extracted {} pattern(s)", result.patterns().size());
        return null;
    }

    // ------------------------------------------------------------------
    // Approval gates
    // ------------------------------------------------------------------

    /**
     * Answer the open approval gate. The run is not continued here; call
     * {@link #run()} afterwards (same session).
     *
     * <ul>
     *   <li>EXTEND: the phase gets one more phase budget.</li>
     *   <li>REDUCE_SCOPE: in phase 3, open unstarted items of the lowest open
     *       priority are closed as descoped; the time gate is waived for the phase.</li>
     *   <li>PROCEED: the time gate is waived for the phase.</li>
     *   <li>NARROW_SCOPE: the tests failing in the last attempt are excluded
     *       from the gate.</li>
     *   <li>RELAX_THRESHOLD: the coverage target drops to the last measured
     *       coverage.</li>
     *   <li>MANUAL_INTERVENTION: the operator fixed things by hand.</li>
     * </ul>
     * Every divergence answer resets the attempt counter and verifies again.
     */
    public Checkpoint answerApproval(ApprovalDecision decision, String note) {
        Checkpoint cp = load();
        PendingApproval gate = cp.getPendingApproval();
        if (gate == null) {
            throw new ApprovalRequiredException(null, "No approval is pending");
        }
        if (!gate.getKind().options().contains(decision)) {
            throw new ApprovalRequiredException(gate.getKind(),
                    decision + " does not answer a " + gate.getKind() + " gate; options are " + gate.getKind().options());
        }

        List<String> descoped = decision == ApprovalDecision.REDUCE_SCOPE
                && cp.getPhase().getCurrent() == PhaseId.PHASE_3_IMPLEMENTATION ? descopeCandidates(cp) : List.of();
        String detail = note == null || note.isBlank() ? "" : " (" + note.strip() + ")";

        Checkpoint updated = store.mutate(c -> {
            int attempt = c.getVerification().getAttemptCount();
            switch (decision) {
                case EXTEND -> c.getPhase().setTimeExtension(c.getPhase().getTimeExtension()
                        .plus(properties.phaseBudget(c.getPhase().getCurrent())));
                case PROCEED -> c.getPhase().setTimeGateWaived(true);
                case REDUCE_SCOPE -> {
                    for (String id : descoped) {
                        c.item(id).setState(ItemState.CLOSED);
                        c.getWorkProgress().markCompleted(id);
                        disclose(c, Disclosure.Type.SCOPE_REDUCED, "descoped #" + id + " " + c.item(id).getTitle() + detail, attempt);
                    }
                    c.getPhase().setTimeGateWaived(true);
                }
                case NARROW_SCOPE -> {
                    List<VerificationFailure> failures = c.getVerification().getFailureHistory();
                    List<String> tests = failures.isEmpty() ? List.of() : failures.get(failures.size() - 1).getFailingTests();
                    c.getVerification().getExcludedTests().addAll(tests);
                    disclose(c, Disclosure.Type.SCOPE_REDUCED, "tests excluded from the gate: " + tests + detail, attempt);
                    resetVerification(c);
                }
                case RELAX_THRESHOLD -> {
                    Double coverage = c.getVerification().getLastCoverage();
                    double target = verificationPolicy.coverageTarget(c.getVerification());
                    if (coverage != null && coverage < target) {
                        c.getVerification().setCoverageTargetOverride(Math.floor(coverage));
                    }
                    disclose(c, Disclosure.Type.THRESHOLD_RELAXED, "coverage target relaxed from %.1f%% to %.1f%%"
                            .formatted(target, verificationPolicy.coverageTarget(c.getVerification())) + detail, attempt);
                    resetVerification(c);
                }
                case MANUAL_INTERVENTION -> resetVerification(c);
            }
            c.setPendingApproval(null);
            if (c.getPhase().getStatus() != PhaseStatus.NOT_STARTED) {
                c.getPhase().setStatus(PhaseStatus.IN_PROGRESS);
            }
            c.setResumeHint(hint(c.getPhase().getCurrent()));
            return c;
        });

        for (String id : descoped) {
            tracker.closeItem(id, "Descoped by operator at a time-budget gate" + detail);
        }
        log.info("Approval {} answered with {}{}", gate.getKind(), decision, detail);
        return updated;
    }

    private List<String> descopeCandidates(Checkpoint cp) {
        String inProgress = cp.getWorkProgress().getInProgressItem();
        List<WorkItem> unstarted = cp.getWorkProgress().getOpenItems().stream()
                .map(cp.getWorkItems()::get)
                .filter(item -> item != null && !item.isUmbrella() && item.getSubUnitsUsed() == 0
                        && !item.getId().equals(inProgress))
                .toList();
        int lowest = unstarted.stream().mapToInt(item -> item.getPriority().rank()).min().orElse(0);
        return unstarted.stream()
                .filter(item -> item.getPriority().rank() == lowest)
                .map(WorkItem::getId)
                .toList();
    }

    private static void resetVerification(Checkpoint c) {
        c.getVerification().setAttemptCount(0);
        c.getPhase().setStatus(PhaseStatus.IN_PROGRESS);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Checkpoint load() {
        return store.load().orElseThrow(() -> new CheckpointException(CheckpointException.Kind.NOT_FOUND,
                "No checkpoint; start a new run first"));
    }

    /** Complete a phase and enter the next one; refuses if the completion predicate fails. */
    private void advance(Checkpoint c, PhaseId phase) {
        c.completePhase(phase);
        Optional<String> unmet = PhasePredicates.unmetReason(phase, c);
        if (unmet.isPresent()) {
            throw new PhaseTransitionException(phase, unmet.get());
        }
        PhaseId next = phase.next();
        c.getPhase().enter(next, clock.instant());
        c.setResumeHint(hint(next));
        log.info("Phase {} complete, entering {}", phase.number(), next.displayName());
    }

    private void logInvocation(Checkpoint c, PhaseCapability capability, String itemId, Instant started) {
        c.getAgentInvocations().add(new AgentInvocation(capability.name(), c.getPhase().getCurrent(),
                itemId, "COMPLETED", started, clock.instant()));
    }

    private void addItem(Checkpoint c, WorkItem item) {
        c.getWorkItems().put(item.getId(), item);
        c.getWorkProgress().getFlaggedItems().remove(item.getId());
        c.getWorkProgress().markOpen(item.getId());
    }

    private void disclose(Checkpoint c, Disclosure.Type type, String detail, int attempt) {
        boolean known = c.getDisclosures().stream()
                .anyMatch(d -> d.getType() == type && d.getDetail().equals(detail));
        if (!known) {
            c.getDisclosures().add(new Disclosure(type, detail, attempt, clock.instant()));
            log.warn("Disclosed compromise [{}] {}", type, detail);
        }
    }

    private static WorkItem scoredItem(String id, String title, WorkItemKind kind, Priority priority,
                                       WorkItemEstimate estimate, ComplexityAssessment assessment) {
        WorkItem item = new WorkItem(id, title, kind, priority);
        item.setEstimate(estimate);
        item.setComplexityScore(assessment.score());
        item.setComplexityCategory(assessment.category());
        item.setEstimatedResource(assessment.estimatedResource());
        return item;
    }

    /**
     * Tracker items of this project that the checkpoint has not recorded (or
     * only recorded as untriaged), by title. An interrupted phase finds the
     * items it created before the interruption here instead of creating
     * duplicates.
     */
    private Map<String, String> unrecordedByTitle(Checkpoint cp) {
        Map<String, String> byTitle = new HashMap<>();
        for (ItemSummary summary : tracker.listItems(ItemFilter.labelled(TrackerLabels.project(name(cp))))) {
            WorkItem known = cp.getWorkItems().get(summary.id());
            if (known == null || PhasePredicates.awaitsTriage(cp, known)) {
                byTitle.putIfAbsent(summary.title(), summary.id());
            }
        }
        return byTitle;
    }

    private String findOrCreate(Map<String, String> existing, String title, String body, Set<String> labels) {
        String id = existing.remove(title);
        if (id != null) {
            log.info("Reusing tracker item #{} for '{}'", id, title);
            return id;
        }
        return tracker.createItem(title, body, labels);
    }

    private static ProjectBrief brief(Checkpoint cp) {
        return new ProjectBrief(cp.getProject().getName(), cp.getProject().getRequest());
    }

    private static String name(Checkpoint cp) {
        return cp.getProject().getName();
    }

    private static String evidence(ImplementationResult result) {
        String artifacts = result.artifacts().isEmpty() ? "" : "\nArtifacts: " + String.join(", ", result.artifacts());
        return nullToEmpty(result.summary()) + artifacts;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String hint(PhaseId phase) {
        return phase == PhaseId.DONE ? "Run complete" : "Start phase " + phase.number() + " (" + phase.displayName() + ")";
    }
}
