package com.forgeloop.orchestrator.tracker;

import com.forgeloop.orchestrator.model.ItemState;

import java.util.Set;

public record ItemSummary(String id, String title, ItemState state, Set<String> labels) {

    public ItemSummary {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
    }

    public boolean isOpen() { return state == ItemState.OPEN; }
}
