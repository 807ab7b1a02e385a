package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.model.ApprovalDecision;
import com.forgeloop.orchestrator.model.ApprovalKind;

import java.util.Set;

/**
 * An approval gate is open (or the answer does not fit the open gate).
 */
public class ApprovalRequiredException extends RuntimeException {

    private final ApprovalKind kind;

    public ApprovalRequiredException(ApprovalKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ApprovalKind getKind() { return kind; }

    public Set<ApprovalDecision> getOptions() {
        return kind == null ? Set.of() : kind.options();
    }
}
