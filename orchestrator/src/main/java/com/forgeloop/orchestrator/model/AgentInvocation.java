package com.forgeloop.orchestrator.model;

import java.time.Instant;

/**
 * Append-only log entry for a completed capability call.
 * Entries are written after the call returns, never before.
 */
public class AgentInvocation {

    private String capability;
    private PhaseId phase;
    private String itemId;
    private String status;
    private Instant startedAt;
    private Instant completedAt;

    public AgentInvocation() {}   // Jackson

    public AgentInvocation(String capability, PhaseId phase, String itemId,
                           String status, Instant startedAt, Instant completedAt) {
        this.capability  = capability;
        this.phase       = phase;
        this.itemId      = itemId;
        this.status      = status;
        this.startedAt   = startedAt;
        this.completedAt = completedAt;
    }

    public String  getCapability()  { return capability; }
    public PhaseId getPhase()       { return phase; }
    public String  getItemId()      { return itemId; }
    public String  getStatus()      { return status; }
    public Instant getStartedAt()   { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }

    public void setCapability(String capability)     { this.capability = capability; }
    public void setPhase(PhaseId phase)              { this.phase = phase; }
    public void setItemId(String itemId)             { this.itemId = itemId; }
    public void setStatus(String status)             { this.status = status; }
    public void setStartedAt(Instant startedAt)      { this.startedAt = startedAt; }
    public void setCompletedAt(Instant completedAt)  { this.completedAt = completedAt; }
}
