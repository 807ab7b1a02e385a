package com.forgeloop.orchestrator.tracker;

import com.forgeloop.orchestrator.model.ItemState;

import java.util.Set;

/**
 * @param state  null for items in any state
 * @param labels items must carry all of these labels
 */
public record ItemFilter(ItemState state, Set<String> labels) {

    public ItemFilter {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
    }

    public static ItemFilter labelled(String... labels) {
        return new ItemFilter(null, Set.of(labels));
    }

    public boolean matches(ItemSummary item) {
        return (state == null || item.state() == state) && item.labels().containsAll(labels);
    }
}
