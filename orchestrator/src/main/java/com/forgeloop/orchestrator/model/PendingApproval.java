package com.forgeloop.orchestrator.model;

import java.time.Instant;

public class PendingApproval {

    private ApprovalKind kind;
    private PhaseId phase;
    private String reason;
    private Instant openedAt;

    public PendingApproval() {}   // Jackson

    public PendingApproval(ApprovalKind kind, PhaseId phase, String reason, Instant openedAt) {
        this.kind     = kind;
        this.phase    = phase;
        this.reason   = reason;
        this.openedAt = openedAt;
    }

    public ApprovalKind getKind()     { return kind; }
    public PhaseId      getPhase()    { return phase; }
    public String       getReason()   { return reason; }
    public Instant      getOpenedAt() { return openedAt; }

    public void setKind(ApprovalKind kind)        { this.kind = kind; }
    public void setPhase(PhaseId phase)           { this.phase = phase; }
    public void setReason(String reason)          { this.reason = reason; }
    public void setOpenedAt(Instant openedAt)     { this.openedAt = openedAt; }
}
