package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.SplitRequest;
import com.forgeloop.orchestrator.agent.contract.SplitResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

/**
 * Only the shape of the answer is checked here. Whether the children satisfy
 * the score limit and form a partial order is decided by ComplexityAnalyzer.
 */
@Component
public class DecompositionCapability extends LlmCapability<SplitRequest, SplitResult> {

    public DecompositionCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, SplitRequest.class, SplitResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.DECOMPOSITION; }

    @Override
    protected String describeTask(SplitRequest input) {
        return "Split work item #" + input.parentId() + " \"" + input.parentTitle()
                + "\" into children scoring at most " + input.maxChildScore() + ".";
    }
}
