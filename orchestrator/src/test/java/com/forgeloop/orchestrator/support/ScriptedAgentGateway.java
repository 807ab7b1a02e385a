package com.forgeloop.orchestrator.support;

import com.forgeloop.orchestrator.agent.AgentCapabilityException;
import com.forgeloop.orchestrator.agent.AgentGateway;
import com.forgeloop.orchestrator.agent.PhaseCapability;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Agent gateway answering from per-capability scripts and recording every call.
 */
public class ScriptedAgentGateway implements AgentGateway {

    private final Map<PhaseCapability, Function<Object, Object>> handlers = new EnumMap<>(PhaseCapability.class);
    private final List<PhaseCapability> calls = new ArrayList<>();
    private final List<Object> inputs = new ArrayList<>();

    @SuppressWarnings("unchecked")
    public <I> ScriptedAgentGateway on(PhaseCapability capability, Function<I, ?> handler) {
        handlers.put(capability, input -> handler.apply((I) input));
        return this;
    }

    public ScriptedAgentGateway unavailable(PhaseCapability capability) {
        handlers.put(capability, input -> {
            throw new AgentCapabilityException(AgentCapabilityException.Kind.UNAVAILABLE, capability, "offline");
        });
        return this;
    }

    @Override
    public <I, O> O invoke(PhaseCapability capability, I input, Class<O> outputType) {
        Function<Object, Object> handler = handlers.get(capability);
        if (handler == null) {
            throw new AgentCapabilityException(AgentCapabilityException.Kind.NOT_REGISTERED, capability, "no script");
        }
        calls.add(capability);
        inputs.add(input);
        return outputType.cast(handler.apply(input));
    }

    public int calls(PhaseCapability capability) {
        return (int) calls.stream().filter(c -> c == capability).count();
    }

    public List<PhaseCapability> calls() { return List.copyOf(calls); }

    /** Inputs passed to a capability, in call order. */
    @SuppressWarnings("unchecked")
    public <I> List<I> inputs(PhaseCapability capability) {
        List<I> result = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            if (calls.get(i) == capability) result.add((I) inputs.get(i));
        }
        return result;
    }
}
