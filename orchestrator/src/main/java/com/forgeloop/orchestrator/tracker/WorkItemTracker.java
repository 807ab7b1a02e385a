package com.forgeloop.orchestrator.tracker;

import java.util.List;
import java.util.Set;

/**
 * The external issue tracker, as seen by the orchestrator.
 *
 * The tracker is ground truth for item state: agents and humans may close or
 * create items behind the orchestrator's back, and ResumeController
 * reconciles the checkpoint against it. Every method may fail with
 * {@link TrackerException}, which suspends the run.
 */
public interface WorkItemTracker {

    /** @return the tracker's id of the new item */
    String createItem(String title, String body, Set<String> labels);

    /** Close an item, leaving the evidence (e.g. the produced artifacts) as a closing note. */
    void closeItem(String id, String evidence);

    List<ItemSummary> listItems(ItemFilter filter);

    void comment(String id, String body);
}
