package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.ComplexityCategory;
import com.forgeloop.orchestrator.model.PhaseId;
import com.forgeloop.orchestrator.model.PhaseStatus;
import com.forgeloop.orchestrator.model.WorkItem;

import java.util.List;
import java.util.Optional;

/**
 * Completion predicate of every phase, evaluated against the checkpoint's
 * structured fields (after reconciliation, so item state reflects the tracker).
 *
 * <pre>
 *   0    infrastructure artifacts recorded
 *   1    PRD recorded, at least one item, every triaged item scored
 *   1.5  no open COMPLEX item without children
 *   2    design artifact recorded
 *   3    no open triaged item
 *   4    QA has completed (recorded in phasesCompleted)
 *   5    verification has passed and the run is not diverged
 *   6    project recorded in history
 * </pre>
 *
 * Items created outside the orchestrator are unscored and flagged until
 * triaged; predicates ignore them and the final report lists them.
 */
public final class PhasePredicates {

    private PhasePredicates() {}

    public static boolean isComplete(PhaseId phase, Checkpoint cp) {
        return switch (phase) {
            case PHASE_0_INFRA           -> hasArtifacts(cp, PhaseId.PHASE_0_INFRA);
            case PHASE_1_DEFINITION      -> hasArtifacts(cp, PhaseId.PHASE_1_DEFINITION)
                                            && !triaged(cp).isEmpty()
                                            && triaged(cp).stream().allMatch(WorkItem::isScored);
            case PHASE_1_5_DECOMPOSITION -> openTriaged(cp).stream().noneMatch(PhasePredicates::needsSplit);
            case PHASE_2_ARCHITECTURE    -> hasArtifacts(cp, PhaseId.PHASE_2_ARCHITECTURE);
            case PHASE_3_IMPLEMENTATION  -> openTriaged(cp).isEmpty();
            case PHASE_4_QA              -> cp.getPhasesCompleted().contains(PhaseId.PHASE_4_QA);
            case PHASE_5_VERIFICATION    -> cp.getPhasesCompleted().contains(PhaseId.PHASE_5_VERIFICATION)
                                            && cp.getPhase().getStatus() != PhaseStatus.DIVERGENCE;
            case PHASE_6_LEARNING        -> cp.getPhasesCompleted().contains(PhaseId.PHASE_6_LEARNING);
            case DONE                    -> false;
        };
    }

    /** The earliest phase whose predicate does not hold, or DONE. */
    public static PhaseId firstIncomplete(Checkpoint cp) {
        for (PhaseId phase : PhaseId.values()) {
            if (phase == PhaseId.DONE) break;
            if (!isComplete(phase, cp)) return phase;
        }
        return PhaseId.DONE;
    }

    /** Reason a phase cannot be left yet, for error reports. */
    public static Optional<String> unmetReason(PhaseId phase, Checkpoint cp) {
        if (isComplete(phase, cp)) return Optional.empty();
        return Optional.of(switch (phase) {
            case PHASE_0_INFRA           -> "no infrastructure artifacts recorded";
            case PHASE_1_DEFINITION      -> "PRD missing, no work items, or unscored items";
            case PHASE_1_5_DECOMPOSITION -> "COMPLEX items still awaiting decomposition: "
                                            + openTriaged(cp).stream().filter(PhasePredicates::needsSplit)
                                                    .map(WorkItem::getId).toList();
            case PHASE_2_ARCHITECTURE    -> "no design artifact recorded";
            case PHASE_3_IMPLEMENTATION  -> "open items remain: " + cp.getWorkProgress().getOpenItems();
            case PHASE_4_QA              -> "QA has not completed";
            case PHASE_5_VERIFICATION    -> "verification has not passed";
            case PHASE_6_LEARNING        -> "project not recorded";
            case DONE                    -> "run is done";
        });
    }

    /** An unscored, flagged item was created outside the orchestrator and waits for triage. */
    public static boolean awaitsTriage(Checkpoint cp, WorkItem item) {
        return !item.isScored() && cp.getWorkProgress().getFlaggedItems().contains(item.getId());
    }

    private static boolean needsSplit(WorkItem item) {
        return item.getComplexityCategory() == ComplexityCategory.COMPLEX && !item.isUmbrella();
    }

    private static boolean hasArtifacts(Checkpoint cp, PhaseId phase) {
        List<String> artifacts = cp.getPhaseArtifacts().get(phase);
        return artifacts != null && !artifacts.isEmpty();
    }

    private static List<WorkItem> triaged(Checkpoint cp) {
        return cp.getWorkItems().values().stream()
                .filter(item -> !awaitsTriage(cp, item))
                .toList();
    }

    private static List<WorkItem> openTriaged(Checkpoint cp) {
        return cp.getWorkProgress().getOpenItems().stream()
                .map(cp.getWorkItems()::get)
                .filter(item -> item != null && !awaitsTriage(cp, item))
                .toList();
    }
}
