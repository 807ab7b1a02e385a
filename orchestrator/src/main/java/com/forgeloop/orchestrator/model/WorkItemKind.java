package com.forgeloop.orchestrator.model;

public enum WorkItemKind {
    FEATURE,
    BUG
}
