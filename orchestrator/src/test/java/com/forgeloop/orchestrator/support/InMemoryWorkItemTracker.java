package com.forgeloop.orchestrator.support;

import com.forgeloop.orchestrator.model.ItemState;
import com.forgeloop.orchestrator.tracker.ItemFilter;
import com.forgeloop.orchestrator.tracker.ItemSummary;
import com.forgeloop.orchestrator.tracker.TrackerException;
import com.forgeloop.orchestrator.tracker.WorkItemTracker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracker fake with numeric ids. Helpers simulate people editing the tracker
 * behind the orchestrator's back.
 */
public class InMemoryWorkItemTracker implements WorkItemTracker {

    private final Map<String, ItemSummary> items = new LinkedHashMap<>();
    private final Map<String, List<String>> notes = new LinkedHashMap<>();
    private int nextId = 1;
    private boolean unreachable;

    @Override
    public String createItem(String title, String body, Set<String> labels) {
        checkReachable();
        String id = String.valueOf(nextId++);
        items.put(id, new ItemSummary(id, title, ItemState.OPEN, labels));
        return id;
    }

    @Override
    public void closeItem(String id, String evidence) {
        checkReachable();
        setState(id, ItemState.CLOSED);
        notes.computeIfAbsent(id, k -> new ArrayList<>()).add(evidence);
    }

    @Override
    public List<ItemSummary> listItems(ItemFilter filter) {
        checkReachable();
        return items.values().stream().filter(filter::matches).toList();
    }

    @Override
    public void comment(String id, String body) {
        checkReachable();
        if (!items.containsKey(id)) {
            throw new TrackerException(TrackerException.Kind.NOT_FOUND, "No item " + id);
        }
        notes.computeIfAbsent(id, k -> new ArrayList<>()).add(body);
    }

    // ------------------------------------------------------------------
    // Test helpers
    // ------------------------------------------------------------------

    public ItemSummary get(String id) { return items.get(id); }

    public List<String> notes(String id) { return notes.getOrDefault(id, List.of()); }

    public List<ItemSummary> all() { return List.copyOf(items.values()); }

    public void reopen(String id)          { setState(id, ItemState.OPEN); }

    public void closeExternally(String id) { setState(id, ItemState.CLOSED); }

    public void delete(String id)          { items.remove(id); }

    public void setUnreachable(boolean unreachable) { this.unreachable = unreachable; }

    private void setState(String id, ItemState state) {
        ItemSummary item = items.get(id);
        if (item == null) {
            throw new TrackerException(TrackerException.Kind.NOT_FOUND, "No item " + id);
        }
        items.put(id, new ItemSummary(id, item.title(), state, item.labels()));
    }

    private void checkReachable() {
        if (unreachable) {
            throw new TrackerException(TrackerException.Kind.UNREACHABLE, "tracker offline");
        }
    }
}
