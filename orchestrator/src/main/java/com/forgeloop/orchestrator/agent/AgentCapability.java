package com.forgeloop.orchestrator.agent;

/**
 * One agent capability with a typed contract.
 *
 * @param <I> input record
 * @param <O> output record
 */
public interface AgentCapability<I, O> {

    PhaseCapability id();

    Class<I> inputType();

    Class<O> outputType();

    O invoke(I input) throws AgentCapabilityException;
}
