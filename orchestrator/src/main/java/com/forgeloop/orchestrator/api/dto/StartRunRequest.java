package com.forgeloop.orchestrator.api.dto;

/**
 * Request body for POST /runs.
 *
 * @param request free-text description of what to build, handed to the agents
 */
public record StartRunRequest(String projectName, String request) {}
