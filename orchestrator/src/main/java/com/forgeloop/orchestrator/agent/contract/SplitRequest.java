package com.forgeloop.orchestrator.agent.contract;

import com.forgeloop.orchestrator.complexity.WorkItemEstimate;

/**
 * Input of DECOMPOSITION.
 *
 * @param feedback null on the first request; on the retry, the reasons the
 *                 previous split was rejected
 */
public record SplitRequest(String parentId,
                           String parentTitle,
                           WorkItemEstimate estimate,
                           long maxChildScore,
                           long maxChildResource,
                           String feedback) {}
