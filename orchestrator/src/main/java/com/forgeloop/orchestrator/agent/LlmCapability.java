package com.forgeloop.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.agent.ClaudeClient.Message;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base class for capabilities answered by a Claude conversation.
 *
 * The conversation is short: the task and the JSON-encoded input go in the
 * first user message; the agent may reason over a few turns and must end
 * with a {@code <result>} tag whose JSON is parsed into the output type.
 */
public abstract class LlmCapability<I, O> implements AgentCapability<I, O> {

    private static final Logger log = LoggerFactory.getLogger(LlmCapability.class);

    private final ClaudeClient  claude;
    private final SystemPrompts systemPrompts;
    private final ObjectMapper  objectMapper;
    private final String        model;
    private final int           maxTurns;
    private final Class<I>      inputType;
    private final Class<O>      outputType;

    protected LlmCapability(ClaudeClient claude,
                            SystemPrompts systemPrompts,
                            ObjectMapper objectMapper,
                            ForgeloopProperties properties,
                            Class<I> inputType,
                            Class<O> outputType) {
        this.claude        = claude;
        this.systemPrompts = systemPrompts;
        this.objectMapper  = objectMapper;
        this.model         = properties.getClaude().getModel();
        this.maxTurns      = Math.max(1, properties.getClaude().getMaxTurns());
        this.inputType     = inputType;
        this.outputType    = outputType;
    }

    /** One-paragraph task statement placed above the input JSON. */
    protected abstract String describeTask(I input);

    /** Reject outputs that parse but are unusable. Default accepts everything. */
    protected void validate(O output) {}

    @Override public Class<I> inputType()  { return inputType; }
    @Override public Class<O> outputType() { return outputType; }

    @Override
    public O invoke(I input) {
        List<Message> history = new ArrayList<>();
        history.add(new Message("user", initialPrompt(input)));
        String system = systemPrompts.get(id());

        for (int turn = 1; turn <= maxTurns; turn++) {
            String response;
            try {
                response = claude.complete(model, history, system);
            } catch (RuntimeException e) {
                throw new AgentCapabilityException(AgentCapabilityException.Kind.UNAVAILABLE, id(),
                        "Claude call failed: " + e.getMessage(), e);
            }

            Optional<String> result = ResponseParser.extractResult(response);
            if (result.isPresent()) {
                O output = parse(result.get());
                validate(output);
                log.debug("{} answered after {} turn(s)", id(), turn);
                return output;
            }
            history.add(new Message("assistant", response));
            history.add(new Message("user",
                    "Continue. When you are done, write the JSON answer inside <result>...</result>."));
        }
        throw new AgentCapabilityException(AgentCapabilityException.Kind.MALFORMED_OUTPUT, id(),
                "No <result> tag after " + maxTurns + " turns");
    }

    private String initialPrompt(I input) {
        try {
            return describeTask(input) + "\n\nINPUT:\n" + objectMapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise input for " + id(), e);
        }
    }

    private O parse(String resultJson) {
        try {
            return objectMapper.readValue(resultJson, outputType);
        } catch (JsonProcessingException e) {
            throw new AgentCapabilityException(AgentCapabilityException.Kind.MALFORMED_OUTPUT, id(),
                    "Result is not a valid " + outputType.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    protected AgentCapabilityException malformed(String message) {
        return new AgentCapabilityException(AgentCapabilityException.Kind.MALFORMED_OUTPUT, id(), message);
    }
}
