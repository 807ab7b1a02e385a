package com.forgeloop.orchestrator.agent;

/**
 * An agent capability could not deliver a usable result.
 *
 * Unchecked so the state machine catches it in one place and suspends the
 * run at its last checkpoint.
 */
public class AgentCapabilityException extends RuntimeException {

    public enum Kind { UNAVAILABLE, MALFORMED_OUTPUT, NOT_REGISTERED }

    private final Kind kind;
    private final PhaseCapability capability;

    public AgentCapabilityException(Kind kind, PhaseCapability capability, String message) {
        super("[" + kind + "] " + capability + ": " + message);
        this.kind       = kind;
        this.capability = capability;
    }

    public AgentCapabilityException(Kind kind, PhaseCapability capability, String message, Throwable cause) {
        super("[" + kind + "] " + capability + ": " + message, cause);
        this.kind       = kind;
        this.capability = capability;
    }

    public Kind            getKind()       { return kind; }
    public PhaseCapability getCapability() { return capability; }
}
