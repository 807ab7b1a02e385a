package com.forgeloop.orchestrator.service;

import com.forgeloop.orchestrator.checkpoint.RunAlreadyActiveException;
import com.forgeloop.orchestrator.checkpoint.RunLease;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.engine.RunOutcome;
import com.forgeloop.orchestrator.engine.RunResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the state machine on one dedicated worker thread.
 *
 * At most one run is active. The run lease on the checkpoint is taken in
 * the caller's thread, so a refusal reaches the caller, and released by the
 * worker when the run stops.
 */
@Component
public class RunExecutor {

    private static final Logger log = LoggerFactory.getLogger(RunExecutor.class);

    private final ExecutorService worker;
    private final Path checkpointPath;
    private final AtomicBoolean active = new AtomicBoolean();
    private final AtomicReference<RunResult> lastResult = new AtomicReference<>();

    @Autowired
    public RunExecutor(ForgeloopProperties properties) {
        this(Path.of(properties.getCheckpoint().getPath()), Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "forgeloop-run");
            t.setDaemon(true);
            return t;
        }));
    }

    RunExecutor(Path checkpointPath, ExecutorService worker) {
        this.checkpointPath = checkpointPath;
        this.worker         = worker;
    }

    /**
     * Claim the checkpoint for a run: marks this executor busy and takes the
     * run lease. Everything that mutates the checkpoint before the run starts
     * happens between this call and {@link #submit(RunLease, Supplier)} or
     * {@link #release(RunLease)}.
     *
     * @throws RunAlreadyActiveException if a run is executing here or in another process
     */
    public RunLease claim() {
        if (!active.compareAndSet(false, true)) {
            throw new RunAlreadyActiveException("A run is already executing; see GET /runs/status");
        }
        try {
            return RunLease.acquire(checkpointPath);
        } catch (RuntimeException e) {
            active.set(false);
            throw e;
        }
    }

    /** Give up a claim without running anything. */
    public void release(RunLease lease) {
        try {
            if (lease != null) {
                lease.close();
            }
        } finally {
            active.set(false);
        }
    }

    /** Claim, then run. */
    public void submit(Supplier<RunResult> run) {
        submit(claim(), run);
    }

    /** Run on the worker under a lease obtained from {@link #claim()}; the worker releases it. */
    public void submit(RunLease lease, Supplier<RunResult> run) {
        try {
            worker.submit(() -> execute(lease, run));
        } catch (RejectedExecutionException e) {
            release(lease);
            throw e;
        }
    }

    private void execute(RunLease lease, Supplier<RunResult> run) {
        try {
            RunResult result = run.get();
            lastResult.set(result);
            log.info("Run stopped: {} in phase {}", result.outcome(),
                    result.phase() == null ? "-" : result.phase().number());
        } catch (Exception e) {
            log.error("Run aborted: {}", e.getMessage(), e);
            lastResult.set(RunResult.of(RunOutcome.FAILED, null, "Run aborted: " + e.getMessage()));
        } finally {
            release(lease);
        }
    }

    public boolean isActive() {
        return active.get();
    }

    public Optional<RunResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    @PreDestroy
    void shutdown() {
        worker.shutdownNow();
    }
}
