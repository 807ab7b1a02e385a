package com.forgeloop.orchestrator.agent.contract;

import java.util.Set;

public record VerificationRequest(String projectName, int attempt, Set<String> quarantinedTests) {}
