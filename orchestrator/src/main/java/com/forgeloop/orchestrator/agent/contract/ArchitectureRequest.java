package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

public record ArchitectureRequest(ProjectBrief brief, List<String> itemTitles) {}
