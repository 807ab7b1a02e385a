package com.forgeloop.orchestrator.api.dto;

import com.forgeloop.orchestrator.model.ApprovalDecision;

/** Request body for POST /runs/approvals. The note ends up in the disclosure log. */
public record ApprovalRequest(ApprovalDecision decision, String note) {}
