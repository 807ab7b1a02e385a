package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.ProjectBrief;
import com.forgeloop.orchestrator.agent.contract.InfraResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

@Component
public class InfraSetupCapability extends LlmCapability<ProjectBrief, InfraResult> {

    public InfraSetupCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, ProjectBrief.class, InfraResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.INFRA_SETUP; }

    @Override
    protected String describeTask(ProjectBrief input) {
        return "Set up the infrastructure for project \"" + input.projectName() + "\".";
    }

    @Override
    protected void validate(InfraResult output) {
        if (output.artifacts().isEmpty()) {
            throw malformed("Infrastructure setup reported no artifacts");
        }
    }
}
