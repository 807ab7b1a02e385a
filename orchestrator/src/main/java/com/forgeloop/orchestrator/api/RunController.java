package com.forgeloop.orchestrator.api;

import com.forgeloop.orchestrator.api.dto.ApprovalRequest;
import com.forgeloop.orchestrator.api.dto.CheckpointView;
import com.forgeloop.orchestrator.api.dto.ResumeResponse;
import com.forgeloop.orchestrator.api.dto.RunStatusResponse;
import com.forgeloop.orchestrator.api.dto.StartRunRequest;
import com.forgeloop.orchestrator.service.OrchestrationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the run lifecycle.
 *
 * POST   /runs                  start a new project
 * POST   /runs/resume           reconcile with the tracker and continue in a new session
 * GET    /runs/status           checkpoint summary and last outcome
 * DELETE /runs?confirm=true     discard the checkpoint (fresh start)
 * POST   /runs/approvals        answer an open approval gate and continue
 *
 * Runs execute in the background; start, resume and approvals return 202.
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final OrchestrationService orchestration;

    public RunController(OrchestrationService orchestration) {
        this.orchestration = orchestration;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"projectName":"invoice-api","request":"REST service for invoices with PDF export"}'
     */
    @PostMapping
    public ResponseEntity<CheckpointView> start(@RequestBody StartRunRequest req) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(CheckpointView.from(orchestration.start(req.projectName(), req.request())));
    }

    @PostMapping("/resume")
    public ResponseEntity<ResumeResponse> resume() {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResumeResponse.from(orchestration.resume()));
    }

    @GetMapping("/status")
    public RunStatusResponse status() {
        return RunStatusResponse.from(orchestration.status());
    }

    @DeleteMapping
    public ResponseEntity<Void> reset(@RequestParam(defaultValue = "false") boolean confirm) {
        orchestration.reset(confirm);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/approvals")
    public ResponseEntity<CheckpointView> answerApproval(@RequestBody ApprovalRequest req) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(CheckpointView.from(orchestration.answerApproval(req.decision(), req.note())));
    }
}
