package com.forgeloop.orchestrator.agent.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient;
import com.forgeloop.orchestrator.agent.LlmCapability;
import com.forgeloop.orchestrator.agent.PhaseCapability;
import com.forgeloop.orchestrator.agent.SystemPrompts;
import com.forgeloop.orchestrator.agent.contract.VerificationRequest;
import com.forgeloop.orchestrator.agent.contract.VerificationResult;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.springframework.stereotype.Component;

@Component
public class VerificationCapability extends LlmCapability<VerificationRequest, VerificationResult> {

    public VerificationCapability(ClaudeClient claude, SystemPrompts prompts, ObjectMapper objectMapper,
            ForgeloopProperties properties) {
        super(claude, prompts, objectMapper, properties, VerificationRequest.class, VerificationResult.class);
    }

    @Override public PhaseCapability id() { return PhaseCapability.VERIFICATION; }

    @Override
    protected String describeTask(VerificationRequest input) {
        return "Verification attempt " + input.attempt() + " for project \"" + input.projectName() + "\".";
    }

    @Override
    protected void validate(VerificationResult output) {
        if (output.tests().isEmpty()) {
            throw malformed("Verification ran no tests");
        }
        if (output.coveragePercent() < 0 || output.coveragePercent() > 100) {
            throw malformed("Coverage out of range: " + output.coveragePercent());
        }
    }
}
