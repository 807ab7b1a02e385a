package com.forgeloop.orchestrator.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Item-level progress of the run.
 *
 * Invariants: completedItems and openItems are disjoint, and inProgressItem
 * is either null or a member of openItems. Mutations use set semantics so that
 * replaying a checkpoint write never double-counts.
 */
public class WorkProgress {

    private int totalItems;
    private Set<String> completedItems = new LinkedHashSet<>();
    private String inProgressItem;
    private Set<String> openItems = new LinkedHashSet<>();
    private Set<String> flaggedItems = new LinkedHashSet<>();

    public int         getTotalItems()     { return totalItems; }
    public Set<String> getCompletedItems() { return completedItems; }
    public String      getInProgressItem() { return inProgressItem; }
    public Set<String> getOpenItems()      { return openItems; }
    public Set<String> getFlaggedItems()   { return flaggedItems; }

    public void setTotalItems(int totalItems)              { this.totalItems = totalItems; }
    public void setCompletedItems(Set<String> v)           { this.completedItems = v; }
    public void setInProgressItem(String inProgressItem)   { this.inProgressItem = inProgressItem; }
    public void setOpenItems(Set<String> v)                { this.openItems = v; }
    public void setFlaggedItems(Set<String> v)             { this.flaggedItems = v; }

    public void markOpen(String itemId) {
        completedItems.remove(itemId);
        openItems.add(itemId);
        recount();
    }

    public void markCompleted(String itemId) {
        openItems.remove(itemId);
        completedItems.add(itemId);
        if (itemId.equals(inProgressItem)) {
            inProgressItem = null;
        }
        recount();
    }

    public void forget(String itemId) {
        openItems.remove(itemId);
        completedItems.remove(itemId);
        flaggedItems.remove(itemId);
        if (itemId.equals(inProgressItem)) {
            inProgressItem = null;
        }
        recount();
    }

    private void recount() {
        this.totalItems = openItems.size() + completedItems.size();
    }
}
