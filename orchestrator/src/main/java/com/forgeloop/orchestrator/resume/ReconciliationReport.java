package com.forgeloop.orchestrator.resume;

import com.forgeloop.orchestrator.model.Checkpoint;
import com.forgeloop.orchestrator.tracker.ItemSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Differences between the checkpoint and the tracker, tracker-side view.
 * Every entry is a correction applied to the checkpoint; none of them is an
 * error.
 */
public record ReconciliationReport(List<String> closedExternally,
                                   List<String> reopenedExternally,
                                   List<ItemSummary> createdExternally,
                                   List<String> deletedExternally) {

    public ReconciliationReport {
        closedExternally   = List.copyOf(closedExternally);
        reopenedExternally = List.copyOf(reopenedExternally);
        createdExternally  = List.copyOf(createdExternally);
        deletedExternally  = List.copyOf(deletedExternally);
    }

    public static ReconciliationReport empty() {
        return new ReconciliationReport(List.of(), List.of(), List.of(), List.of());
    }

    /** Compare the checkpoint's item sets with the project's tracker items. */
    public static ReconciliationReport between(Checkpoint cp, List<ItemSummary> trackerItems) {
        Map<String, ItemSummary> tracked = trackerItems.stream()
                .collect(Collectors.toMap(ItemSummary::id, Function.identity(), (a, b) -> a));
        Set<String> open      = cp.getWorkProgress().getOpenItems();
        Set<String> completed = cp.getWorkProgress().getCompletedItems();

        List<String> closed   = new ArrayList<>();
        List<String> reopened = new ArrayList<>();
        List<String> deleted  = new ArrayList<>();
        for (String id : open) {
            ItemSummary item = tracked.get(id);
            if (item == null) deleted.add(id);
            else if (!item.isOpen()) closed.add(id);
        }
        for (String id : completed) {
            ItemSummary item = tracked.get(id);
            if (item == null) deleted.add(id);
            else if (item.isOpen()) reopened.add(id);
        }
        List<ItemSummary> created = trackerItems.stream()
                .filter(item -> !open.contains(item.id()) && !completed.contains(item.id())
                        && !cp.getWorkItems().containsKey(item.id()))
                .toList();
        return new ReconciliationReport(closed, reopened, created, deleted);
    }

    public int size() {
        return closedExternally.size() + reopenedExternally.size()
                + createdExternally.size() + deletedExternally.size();
    }

    public boolean isEmpty() { return size() == 0; }

    public String render() {
        if (isEmpty()) {
            return "Checkpoint and tracker agree";
        }
        StringBuilder sb = new StringBuilder("Reconciliation delta (tracker wins):");
        closedExternally.forEach(id -> sb.append("\n  closed in tracker:   #").append(id));
        reopenedExternally.forEach(id -> sb.append("\n  reopened in tracker: #").append(id));
        createdExternally.forEach(item -> sb.append("\n  created in tracker:  #").append(item.id())
                .append(" ").append(item.title()).append(" (flagged for triage)"));
        deletedExternally.forEach(id -> sb.append("\n  gone from tracker:   #").append(id));
        return sb.toString();
    }
}
