package com.forgeloop.orchestrator.agent;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-process registry of agent capabilities, and the production
 * {@link AgentGateway}.
 *
 * All {@link AgentCapability} beans are collected at startup. Every call is
 * timed and counted:
 * <pre>
 *   forgeloop.capability.calls{capability, status="success|unavailable|malformed_output"}
 *   forgeloop.capability.duration{capability}
 * </pre>
 */
@Component
public class CapabilityRegistry implements AgentGateway {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<PhaseCapability, AgentCapability<?, ?>> capabilities = new EnumMap<>(PhaseCapability.class);
    private final MeterRegistry meterRegistry;

    public CapabilityRegistry(List<AgentCapability<?, ?>> allCapabilities, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (AgentCapability<?, ?> capability : allCapabilities) {
            AgentCapability<?, ?> previous = capabilities.put(capability.id(), capability);
            if (previous != null) {
                throw new IllegalStateException("Two capabilities registered for " + capability.id());
            }
            log.info("Registered capability {} for {} ({} -> {})", capability.id(), capability.id().phase(),
                    capability.inputType().getSimpleName(), capability.outputType().getSimpleName());
        }
    }

    public Set<PhaseCapability> registered() {
        return capabilities.keySet();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <I, O> O invoke(PhaseCapability id, I input, Class<O> outputType) {
        AgentCapability<?, ?> found = capabilities.get(id);
        if (found == null) {
            throw new AgentCapabilityException(AgentCapabilityException.Kind.NOT_REGISTERED, id,
                    "No capability registered");
        }
        if (!outputType.isAssignableFrom(found.outputType()) || !found.inputType().isInstance(input)) {
            throw new IllegalArgumentException("Capability %s is %s -> %s, called with %s -> %s".formatted(
                    id, found.inputType().getSimpleName(), found.outputType().getSimpleName(),
                    input == null ? "null" : input.getClass().getSimpleName(), outputType.getSimpleName()));
        }
        AgentCapability<I, O> capability = (AgentCapability<I, O>) found;

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return capability.invoke(input);
        } catch (AgentCapabilityException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "unavailable";
            throw new AgentCapabilityException(AgentCapabilityException.Kind.UNAVAILABLE, id,
                    "Unexpected error: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("forgeloop.capability.duration", "capability", id.name()));
            meterRegistry.counter("forgeloop.capability.calls",
                    "capability", id.name(), "status", status).increment();
        }
    }
}
