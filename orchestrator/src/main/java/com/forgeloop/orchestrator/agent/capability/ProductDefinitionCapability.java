package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.ProjectBrief;
import com.forgeloop.orchestrator.agent.contract.DefinitionResult;
import com.forgeloop.orchestrator.agent.contract.ItemDraft;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

@Component
public class ProductDefinitionCapability extends LlmCapability<ProjectBrief, DefinitionResult> {

    public ProductDefinitionCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, ProjectBrief.class, DefinitionResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.PRODUCT_DEFINITION; }

    @Override
    protected String describeTask(ProjectBrief input) {
        return "Define the product for project \"" + input.projectName() + "\" and list its work items.";
    }

    @Override
    protected void validate(DefinitionResult output) {
        if (output.prdArtifact() == null || output.prdArtifact().isBlank()) {
            throw malformed("No PRD artifact");
        }
        for (ItemDraft item : output.items()) {
            if (item.title() == null || item.title().isBlank() || item.estimate() == null) {
                throw malformed("Every work item needs a title and an estimate");
            }
        }
    }
}
