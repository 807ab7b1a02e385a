package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.QaRequest;
import com.forgeloop.orchestrator.agent.contract.QaResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

@Component
public class QaCapability extends LlmCapability<QaRequest, QaResult> {

    public QaCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, QaRequest.class, QaResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.QA; }

    @Override
    protected String describeTask(QaRequest input) {
        return "Run QA over the " + input.completedItemTitles().size()
                + " completed items of project \"" + input.projectName() + "\".";
    }
}
