package com.forgeloop.orchestrator.agent.contract;

public record ArchitectureResult(String designArtifact) {}
