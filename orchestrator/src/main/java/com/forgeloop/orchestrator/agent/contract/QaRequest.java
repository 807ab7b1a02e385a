package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

public record QaRequest(String projectName, List<String> completedItemTitles) {}
