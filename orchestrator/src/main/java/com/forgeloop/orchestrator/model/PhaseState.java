package com.forgeloop.orchestrator.model;

import java.time.Duration;
import java.time.Instant;

public class PhaseState {

    private PhaseId current = PhaseId.PHASE_0_INFRA;
    private String name = PhaseId.PHASE_0_INFRA.displayName();
    private Instant startedAt;
    private PhaseStatus status = PhaseStatus.NOT_STARTED;

    // Extra wall-clock time granted by the operator at a time-budget gate.
    private Duration timeExtension = Duration.ZERO;

    // Operator chose "proceed as-is": the time gate stays closed for this phase.
    private boolean timeGateWaived;

    public PhaseId     getCurrent()       { return current; }
    public String      getName()          { return name; }
    public Instant     getStartedAt()     { return startedAt; }
    public PhaseStatus getStatus()        { return status; }
    public Duration    getTimeExtension() { return timeExtension; }
    public boolean     isTimeGateWaived() { return timeGateWaived; }

    public void setCurrent(PhaseId current)            { this.current = current; }
    public void setName(String name)                   { this.name = name; }
    public void setStartedAt(Instant startedAt)        { this.startedAt = startedAt; }
    public void setStatus(PhaseStatus status)          { this.status = status; }
    public void setTimeExtension(Duration v)           { this.timeExtension = v; }
    public void setTimeGateWaived(boolean v)           { this.timeGateWaived = v; }

    /** Enter a phase: resets the clock and any time-gate decisions of the previous phase. */
    public void enter(PhaseId phase, Instant now) {
        this.current        = phase;
        this.name           = phase.displayName();
        this.startedAt      = now;
        this.status         = phase == PhaseId.DONE ? PhaseStatus.COMPLETE : PhaseStatus.IN_PROGRESS;
        this.timeExtension  = Duration.ZERO;
        this.timeGateWaived = false;
    }
}
