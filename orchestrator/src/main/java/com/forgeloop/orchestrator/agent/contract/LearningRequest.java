package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

public record LearningRequest(String projectName, String runSummary, List<String> disclosures) {}
