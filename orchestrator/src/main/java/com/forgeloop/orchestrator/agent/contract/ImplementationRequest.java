package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

/**
 * One checkpointed sub-unit of work on an item.
 *
 * @param existingArtifacts artifacts already recorded for the project, so an
 *                          interrupted sub-unit re-run can skip what exists
 * @param focus             failing checks to address, or null for regular work
 */
public record ImplementationRequest(String itemId,
                                    String title,
                                    int subUnit,
                                    int plannedSubUnits,
                                    List<String> existingArtifacts,
                                    String focus) {}
