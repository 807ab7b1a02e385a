package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.LearningRequest;
import com.forgeloop.orchestrator.agent.contract.LearningResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

@Component
public class LearningCapability extends LlmCapability<LearningRequest, LearningResult> {

    public LearningCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, LearningRequest.class, LearningResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.LEARNING; }

    @Override
    protected String describeTask(LearningRequest input) {
        return "Extract learnings from the completed project \"" + input.projectName() + "\".";
    }
}
