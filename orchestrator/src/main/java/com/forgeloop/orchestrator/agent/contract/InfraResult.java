package com.forgeloop.orchestrator.agent.contract;

import java.util.List;

/** Output of INFRA_SETUP: identifiers of the files it produced. */
public record InfraResult(List<String> artifacts) {

    public InfraResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
