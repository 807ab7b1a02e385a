package com.forgeloop.orchestrator.engine;

/**
 * How an item will be implemented: in one sub-unit, or in two or three
 * checkpointed sub-units when its estimate is in the upper band.
 */
public record SchedulingPlan(String itemId, long estimatedResource, int plannedSubUnits) {}
