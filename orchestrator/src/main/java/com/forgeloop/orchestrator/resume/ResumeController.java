package com.forgeloop.orchestrator.resume;

import com.forgeloop.orchestrator.checkpoint.CheckpointStore;
import com.forgeloop.orchestrator.engine.PhasePredicates;
import com.forgeloop.orchestrator.engine.ResourceLedger;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.ItemState;
import com.forgeloop.orchestrator.model.PhaseId;
import com.forgeloop.orchestrator.model.PhaseStatus;
import com.forgeloop.orchestrator.model.WorkItem;
import com.forgeloop.orchestrator.tracker.ItemFilter;
import com.forgeloop.orchestrator.tracker.ItemSummary;
import com.forgeloop.orchestrator.tracker.TrackerLabels;
import com.forgeloop.orchestrator.tracker.WorkItemTracker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a stored checkpoint back into a point the state machine can run from.
 *
 * Steps: load, reconcile against the tracker (the tracker is ground truth
 * for item state, every correction is logged), re-evaluate the phase
 * predicates, and open a fresh resource session. A corrupt checkpoint is
 * reported and never replaced.
 */
@Service
public class ResumeController {

    private static final Logger log = LoggerFactory.getLogger(ResumeController.class);

    private final CheckpointStore store;
    private final WorkItemTracker tracker;
    private final ResourceLedger  ledger;
    private final Clock           clock;
    private final MeterRegistry   meterRegistry;

    public ResumeController(CheckpointStore store, WorkItemTracker tracker, ResourceLedger ledger,
                            Clock clock, MeterRegistry meterRegistry) {
        this.store         = store;
        this.tracker       = tracker;
        this.ledger        = ledger;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    public ResumptionPoint resume() {
        Optional<Checkpoint> loaded = store.load();
        if (loaded.isEmpty()) {
            log.info("No checkpoint found, treating as a new project");
            return ResumptionPoint.forNewProject();
        }
        Checkpoint cp = loaded.get();
        String project = cp.getProject().getName();

        List<ItemSummary> trackerItems = tracker.listItems(ItemFilter.labelled(TrackerLabels.project(project)));
        ReconciliationReport report = ReconciliationReport.between(cp, trackerItems);
        String sessionId = UUID.randomUUID().toString();

        Checkpoint updated = store.mutate(c -> {
            apply(c, report);
            ledger.startSession(c.getResourceTracking(), sessionId);
            PhaseId resumeAt = resumePhase(c);
            if (resumeAt != c.getPhase().getCurrent()) {
                log.warn("Completion predicates no longer hold from phase {}, re-entering it", resumeAt.number());
                c.getPhase().enter(resumeAt, clock.instant());
                c.setResumeHint("Re-entered phase " + resumeAt.number() + " after reconciliation");
            }
            return c;
        });

        if (report.isEmpty()) {
            log.info("Resuming project '{}': {}", project, report.render());
        } else {
            log.warn("Resuming project '{}': {}", project, report.render());
            meterRegistry.counter("forgeloop.reconciliation.deltas").increment(report.size());
        }

        int attempt = updated.getVerification().getAttemptCount();
        return new ResumptionPoint(updated.getPhase().getCurrent(),
                updated.getWorkProgress().getInProgressItem(),
                attempt > 0 ? attempt : null,
                report,
                false);
    }

    /**
     * Re-entry phase: the stored phase, moved back to the earliest phase whose
     * predicate no longer holds. Gated runs (awaiting approval, diverged) stay
     * where they are until the operator answers.
     *
     * Once planning is over the run never moves back before implementation:
     * COMPLEX items that appear later (QA bugs, remainders) are decomposed by
     * the implementation loop itself.
     */
    static PhaseId resumePhase(Checkpoint cp) {
        PhaseId current = cp.getPhase().getCurrent();
        PhaseStatus status = cp.getPhase().getStatus();
        if (status == PhaseStatus.NOT_STARTED || status == PhaseStatus.DIVERGENCE
                || status == PhaseStatus.AWAITING_APPROVAL) {
            return current;
        }
        PhaseId target = PhasePredicates.firstIncomplete(cp);
        if (!current.isBefore(PhaseId.PHASE_3_IMPLEMENTATION) && target.isBefore(PhaseId.PHASE_3_IMPLEMENTATION)) {
            target = PhasePredicates.isComplete(PhaseId.PHASE_3_IMPLEMENTATION, cp)
                    ? current : PhaseId.PHASE_3_IMPLEMENTATION;
        }
        return target.isBefore(current) ? target : current;
    }

    private static void apply(Checkpoint c, ReconciliationReport report) {
        for (String id : report.closedExternally()) {
            c.getWorkProgress().markCompleted(id);
            setState(c, id, ItemState.CLOSED);
        }
        for (String id : report.reopenedExternally()) {
            c.getWorkProgress().markOpen(id);
            setState(c, id, ItemState.OPEN);
        }
        for (ItemSummary external : report.createdExternally()) {
            WorkItem item = new WorkItem(external.id(), external.title(),
                    TrackerLabels.kindOf(external.labels()), TrackerLabels.priorityOf(external.labels()));
            item.setState(external.state());
            c.getWorkItems().put(item.getId(), item);
            if (external.isOpen()) {
                c.getWorkProgress().markOpen(item.getId());
            } else {
                c.getWorkProgress().markCompleted(item.getId());
            }
            c.getWorkProgress().getFlaggedItems().add(item.getId());
        }
        for (String id : report.deletedExternally()) {
            c.getWorkProgress().forget(id);
            c.getWorkItems().remove(id);
            for (WorkItem other : c.getWorkItems().values()) {
                other.getDependsOn().remove(id);
                other.getChildren().remove(id);
            }
        }
    }

    private static void setState(Checkpoint c, String id, ItemState state) {
        WorkItem item = c.getWorkItems().get(id);
        if (item != null) {
            item.setState(state);
        }
    }
}
