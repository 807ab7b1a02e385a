package com.forgeloop.orchestrator.model;

public enum ItemState {
    OPEN,
    CLOSED
}
