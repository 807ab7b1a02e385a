package com.forgeloop.orchestrator.api.dto;

import com.forgeloop.orchestrator.optimizer.ThresholdRecommendation;

import java.util.List;

/**
 * Request body for POST /optimizer/approvals: the recommendations the
 * approver accepts, exactly as the analysis returned them.
 */
public record ThresholdApprovalRequest(String approver, List<ThresholdRecommendation> recommendations) {

    public ThresholdApprovalRequest {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
