package com.forgeloop.orchestrator.agent;

/**
 * The orchestrator's only door to agent capabilities.
 *
 * Calls may be slow and may fail; a failure is reported as
 * {@link AgentCapabilityException} and the caller suspends the run.
 */
public interface AgentGateway {

    <I, O> O invoke(PhaseCapability capability, I input, Class<O> outputType) throws AgentCapabilityException;
}
