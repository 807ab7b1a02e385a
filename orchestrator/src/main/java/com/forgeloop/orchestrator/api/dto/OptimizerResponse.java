package com.forgeloop.orchestrator.api.dto;

import com.forgeloop.orchestrator.optimizer.OptimizationReport;

/** Structured optimizer report plus its Markdown rendering. */
public record OptimizerResponse(OptimizationReport report, String markdown) {}
