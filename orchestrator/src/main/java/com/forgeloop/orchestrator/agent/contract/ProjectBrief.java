package com.forgeloop.orchestrator.agent.contract;

/** Input of INFRA_SETUP and PRODUCT_DEFINITION. */
public record ProjectBrief(String projectName, String request) {}
