package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.ImplementationRequest;
import com.forgeloop.orchestrator.agent.contract.ImplementationResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

@Component
public class ImplementationCapability extends LlmCapability<ImplementationRequest, ImplementationResult> {

    public ImplementationCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, ImplementationRequest.class, ImplementationResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.IMPLEMENTATION; }

    @Override
    protected String describeTask(ImplementationRequest input) {
        String task = "Implement sub-unit %d of %d for work item #%s \"%s\"."
                .formatted(input.subUnit(), input.plannedSubUnits(), input.itemId(), input.title());
        return input.focus() == null ? task : task + " Fix these failing checks: " + input.focus();
    }

    @Override
    protected void validate(ImplementationResult output) {
        if (output.cost() < 0) {
            throw malformed("Negative cost " + output.cost());
        }
        if (!output.itemComplete() && output.remainingEstimate() == null) {
            throw malformed("An unfinished sub-unit must estimate the remaining work");
        }
    }
}
