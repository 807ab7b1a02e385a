package com.forgeloop.orchestrator.service;

import com.forgeloop.orchestrator.engine.RunResult;
import com.forgeloop.orchestrator.model.Checkpoint;

/**
 * @param checkpoint null when no project has been started
 * @param lastResult outcome of the last run in this process, or null
 */
public record RunStatus(boolean active, Checkpoint checkpoint, RunResult lastResult) {}
