package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.ArchitectureRequest;
import com.forgeloop.orchestrator.agent.contract.ArchitectureResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

@Component
public class ArchitectureCapability extends LlmCapability<ArchitectureRequest, ArchitectureResult> {

    public ArchitectureCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, ArchitectureRequest.class, ArchitectureResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.ARCHITECTURE; }

    @Override
    protected String describeTask(ArchitectureRequest input) {
        return "Design the architecture for project \"" + input.brief().projectName()
                + "\" covering " + input.itemTitles().size() + " work items.";
    }

    @Override
    protected void validate(ArchitectureResult output) {
        if (output.designArtifact() == null || output.designArtifact().isBlank()) {
            throw malformed("No design artifact");
        }
    }
}
