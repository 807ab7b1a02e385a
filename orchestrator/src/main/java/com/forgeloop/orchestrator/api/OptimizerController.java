package com.forgeloop.orchestrator.api;

import com.forgeloop.orchestrator.api.dto.OptimizerResponse;
import com.forgeloop.orchestrator.api.dto.ThresholdApprovalRequest;
import com.forgeloop.orchestrator.config.TunableThresholds;
import com.forgeloop.orchestrator.history.ProjectHistoryService;
import com.forgeloop.orchestrator.optimizer.OptimizationReport;
import com.forgeloop.orchestrator.optimizer.ThresholdApprovalService;
import com.forgeloop.orchestrator.optimizer.ThresholdOptimizer;
import com.forgeloop.orchestrator.optimizer.ThresholdReportRenderer;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * POST /optimizer/analyze     advisory recommendations from project history
 * POST /optimizer/approvals   apply approved recommendations to the live thresholds
 * GET  /optimizer/thresholds  current threshold values
 */
@RestController
@RequestMapping("/optimizer")
public class OptimizerController {

    private final ProjectHistoryService    history;
    private final ThresholdOptimizer       optimizer;
    private final ThresholdReportRenderer  renderer;
    private final ThresholdApprovalService approvals;
    private final TunableThresholds        thresholds;

    public OptimizerController(ProjectHistoryService history,
                               ThresholdOptimizer optimizer,
                               ThresholdReportRenderer renderer,
                               ThresholdApprovalService approvals,
                               TunableThresholds thresholds) {
        this.history    = history;
        this.optimizer  = optimizer;
        this.renderer   = renderer;
        this.approvals  = approvals;
        this.thresholds = thresholds;
    }

    @PostMapping("/analyze")
    public OptimizerResponse analyze() {
        OptimizationReport report = optimizer.analyze(history.history());
        return new OptimizerResponse(report, renderer.render(report));
    }

    @PostMapping("/approvals")
    public Map<String, Long> approve(@RequestBody ThresholdApprovalRequest req) {
        return approvals.apply(req.recommendations(), req.approver());
    }

    @GetMapping("/thresholds")
    public Map<String, Long> thresholds() {
        return thresholds.snapshot();
    }
}
