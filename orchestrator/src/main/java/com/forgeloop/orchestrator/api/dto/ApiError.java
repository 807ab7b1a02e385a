package com.forgeloop.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.forgeloop.orchestrator.model.ApprovalDecision;

import java.util.Set;

/**
 * Error body for every failed request.
 *
 * @param options allowed answers when an approval gate is open
 * @param report  human-readable report for hard stops (divergence)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(int status, String error, String message, Set<ApprovalDecision> options, String report) {

    public static ApiError of(int status, String error, String message) {
        return new ApiError(status, error, message, null, null);
    }
}
