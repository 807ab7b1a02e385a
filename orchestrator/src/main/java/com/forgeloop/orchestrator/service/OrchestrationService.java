package com.forgeloop.orchestrator.service;

import com.forgeloop.orchestrator.checkpoint.CheckpointException;
import com.forgeloop.orchestrator.checkpoint.CheckpointStore;
import com.forgeloop.orchestrator.checkpoint.RunAlreadyActiveException;
import com.forgeloop.orchestrator.checkpoint.RunLease;
import com.forgeloop.orchestrator.engine.ApprovalRequiredException;
import com.forgeloop.orchestrator.engine.PhaseStateMachine;
import com.forgeloop.orchestrator.engine.ResourceLedger;
import com.forgeloop.orchestrator.engine.RunReports;
import com.forgeloop.orchestrator.engine.VerificationDivergenceException;
import com.forgeloop.orchestrator.model.ApprovalDecision;
import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.model.PhaseStatus;
import com.forgeloop.orchestrator.model.ProjectIdentity;
import com.forgeloop.orchestrator.resume.ResumeController;
import com.forgeloop.orchestrator.resume.ResumptionPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry points behind the REST surface: start, resume, status, reset and
 * approval answers. Runs themselves execute on {@link RunExecutor}.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    private final CheckpointStore   store;
    private final ResumeController  resumeController;
    private final PhaseStateMachine machine;
    private final ResourceLedger    ledger;
    private final RunExecutor       executor;

    public OrchestrationService(CheckpointStore store,
                                ResumeController resumeController,
                                PhaseStateMachine machine,
                                ResourceLedger ledger,
                                RunExecutor executor) {
        this.store            = store;
        this.resumeController = resumeController;
        this.machine          = machine;
        this.ledger           = ledger;
        this.executor         = executor;
    }

    /**
     * Start a new project. Refused while any checkpoint exists: an existing
     * project is continued with {@link #resume()} or discarded with
     * {@link #reset(boolean)}.
     */
    public synchronized Checkpoint start(String projectName, String request) {
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("projectName is required");
        }
        RunLease lease = executor.claim();
        try {
            if (store.exists()) {
                throw new RunAlreadyActiveException(
                        "A checkpoint already exists; resume it with POST /runs/resume or discard it with DELETE /runs?confirm=true");
            }
            store.initialize(new ProjectIdentity(projectName.strip(), request));
            Checkpoint cp = store.mutate(c -> {
                ledger.startSession(c.getResourceTracking(), UUID.randomUUID().toString());
                return c;
            });
            executor.submit(lease, () -> machine.run(ResumptionPoint.forNewProject()));
            log.info("Started project '{}'", cp.getProject().getName());
            return cp;
        } catch (RuntimeException e) {
            executor.release(lease);
            throw e;
        }
    }

    /**
     * Reconcile and continue the stored project in a new session. The run
     * lease is held before reconciliation touches the checkpoint.
     *
     * @throws CheckpointException             NOT_FOUND when there is nothing to resume
     * @throws ApprovalRequiredException       when an approval gate must be answered first
     * @throws VerificationDivergenceException when the run is diverged
     */
    public synchronized ResumptionPoint resume() {
        RunLease lease = executor.claim();
        try {
            ResumptionPoint point = resumeController.resume();
            if (point.newProject()) {
                throw new CheckpointException(CheckpointException.Kind.NOT_FOUND,
                        "No checkpoint to resume; start a new run with POST /runs");
            }
            Checkpoint cp = store.load().orElseThrow();
            if (cp.getPhase().getStatus() == PhaseStatus.DIVERGENCE) {
                throw new VerificationDivergenceException(cp.getVerification().getAttemptCount(), RunReports.divergence(cp));
            }
            if (cp.getPendingApproval() != null) {
                throw new ApprovalRequiredException(cp.getPendingApproval().getKind(),
                        "Answer the open approval gate with POST /runs/approvals: " + cp.getPendingApproval().getReason());
            }
            executor.submit(lease, () -> machine.run(point));
            return point;
        } catch (RuntimeException e) {
            executor.release(lease);
            throw e;
        }
    }

    /** Answer the open approval gate and continue the run in the current session. */
    public synchronized Checkpoint answerApproval(ApprovalDecision decision, String note) {
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        RunLease lease = executor.claim();
        try {
            Checkpoint cp = machine.answerApproval(decision, note);
            executor.submit(lease, machine::run);
            return cp;
        } catch (RuntimeException e) {
            executor.release(lease);
            throw e;
        }
    }

    public RunStatus status() {
        Checkpoint cp = store.load().orElse(null);
        return new RunStatus(executor.isActive(), cp, executor.lastResult().orElse(null));
    }

    /** Discard the checkpoint so the next start is a fresh project. Explicit operator action only. */
    public synchronized void reset(boolean confirm) {
        if (!confirm) {
            throw new IllegalArgumentException("Discarding the checkpoint requires confirm=true");
        }
        RunLease lease = executor.claim();
        try {
            store.delete();
            log.warn("Checkpoint discarded by operator");
        } finally {
            executor.release(lease);
        }
    }
}
