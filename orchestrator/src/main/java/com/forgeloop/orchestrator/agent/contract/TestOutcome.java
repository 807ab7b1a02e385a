package com.forgeloop.orchestrator.agent.contract;

/**
 * @param itemId the work item the test belongs to, when known
 */
public record TestOutcome(String name, boolean passed, String itemId, String message) {}
