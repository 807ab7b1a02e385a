package com.forgeloop.orchestrator.api;

import com.forgeloop.orchestrator.agent.AgentCapabilityException;
import com.forgeloop.orchestrator.api.dto.ApiError;
import com.forgeloop.orchestrator.checkpoint.CheckpointException;
import com.forgeloop.orchestrator.checkpoint.RunAlreadyActiveException;
import com.forgeloop.orchestrator.engine.ApprovalRequiredException;
import com.forgeloop.orchestrator.engine.VerificationDivergenceException;
import com.forgeloop.orchestrator.optimizer.StaleRecommendationException;
import com.forgeloop.orchestrator.tracker.TrackerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP responses.
 *
 * <pre>
 *   404  no checkpoint
 *   409  run already active, approval pending, divergence, stale recommendation
 *   422  corrupt or unsupported checkpoint (never auto-deleted)
 *   503  agent, tracker or checkpoint I/O unavailable
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CheckpointException.class)
    ResponseEntity<ApiError> checkpoint(CheckpointException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND                          -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS                     -> HttpStatus.CONFLICT;
            case CORRUPT_STATE, UNSUPPORTED_VERSION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case IO_FAILURE                         -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        if (status == HttpStatus.UNPROCESSABLE_ENTITY) {
            log.error("Checkpoint unusable: {}", e.getMessage());
        }
        return error(status, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(RunAlreadyActiveException.class)
    ResponseEntity<ApiError> runActive(RunAlreadyActiveException e) {
        return error(HttpStatus.CONFLICT, "RUN_ALREADY_ACTIVE", e.getMessage());
    }

    @ExceptionHandler(ApprovalRequiredException.class)
    ResponseEntity<ApiError> approvalRequired(ApprovalRequiredException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError(HttpStatus.CONFLICT.value(),
                "APPROVAL_REQUIRED", e.getMessage(), e.getOptions(), null));
    }

    @ExceptionHandler(VerificationDivergenceException.class)
    ResponseEntity<ApiError> divergence(VerificationDivergenceException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError(HttpStatus.CONFLICT.value(),
                "VERIFICATION_DIVERGENCE", e.getMessage(), null, e.getReport()));
    }

    @ExceptionHandler(StaleRecommendationException.class)
    ResponseEntity<ApiError> stale(StaleRecommendationException e) {
        return error(HttpStatus.CONFLICT, "STALE_RECOMMENDATION", e.getMessage());
    }

    @ExceptionHandler({AgentCapabilityException.class, TrackerException.class})
    ResponseEntity<ApiError> unavailable(RuntimeException e) {
        log.warn("External collaborator unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "EXTERNAL_FAILURE", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ApiError.of(status.value(), code, message));
    }
}
