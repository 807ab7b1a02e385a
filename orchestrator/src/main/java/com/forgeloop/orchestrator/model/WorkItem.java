package com.forgeloop.orchestrator.model;

import com.forgeloop.orchestrator.complexity.WorkItemEstimate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A schedulable unit of work (feature or defect) as recorded in the checkpoint.
 *
 * The id is the tracker's item id. Scoring fields are null until the item has
 * been scored by the ComplexityAnalyzer; an unscored item is never scheduled.
 * An item with children is an umbrella: it is closed automatically once every
 * child is complete and is never implemented itself.
 */
public class WorkItem {

    private String id;
    private String title;
    private WorkItemKind kind = WorkItemKind.FEATURE;
    private Priority priority = Priority.MEDIUM;
    private ItemState state = ItemState.OPEN;

    private WorkItemEstimate estimate;
    private Integer complexityScore;
    private ComplexityCategory complexityCategory;
    private Long estimatedResource;
    private long actualResource;

    private Set<String> dependsOn = new LinkedHashSet<>();
    private String parentId;
    private List<String> children = new ArrayList<>();

    // Failing checks a fix item must address; null for regular items.
    private String focus;

    // Number of checkpointed sub-units (commits) spent on this item.
    private int subUnitsUsed;

    // Set when the item hit the per-item ceiling and its remainder was split off.
    private boolean splitMidItem;

    public WorkItem() {}   // Jackson

    public WorkItem(String id, String title, WorkItemKind kind, Priority priority) {
        this.id       = id;
        this.title    = title;
        this.kind     = kind;
        this.priority = priority;
    }

    public boolean isScored()   { return complexityScore != null && estimatedResource != null; }
    public boolean isUmbrella() { return !children.isEmpty(); }

    public String             getId()                 { return id; }
    public String             getTitle()              { return title; }
    public WorkItemKind       getKind()               { return kind; }
    public Priority           getPriority()           { return priority; }
    public ItemState          getState()              { return state; }
    public WorkItemEstimate   getEstimate()           { return estimate; }
    public Integer            getComplexityScore()    { return complexityScore; }
    public ComplexityCategory getComplexityCategory() { return complexityCategory; }
    public Long               getEstimatedResource()  { return estimatedResource; }
    public long               getActualResource()     { return actualResource; }
    public Set<String>        getDependsOn()          { return dependsOn; }
    public String             getParentId()           { return parentId; }
    public List<String>       getChildren()           { return children; }
    public String             getFocus()              { return focus; }
    public int                getSubUnitsUsed()       { return subUnitsUsed; }
    public boolean            isSplitMidItem()        { return splitMidItem; }

    public void setId(String id)                                 { this.id = id; }
    public void setTitle(String title)                           { this.title = title; }
    public void setKind(WorkItemKind kind)                       { this.kind = kind; }
    public void setPriority(Priority priority)                   { this.priority = priority; }
    public void setState(ItemState state)                        { this.state = state; }
    public void setEstimate(WorkItemEstimate estimate)           { this.estimate = estimate; }
    public void setComplexityScore(Integer v)                    { this.complexityScore = v; }
    public void setComplexityCategory(ComplexityCategory v)      { this.complexityCategory = v; }
    public void setEstimatedResource(Long v)                     { this.estimatedResource = v; }
    public void setActualResource(long v)                        { this.actualResource = v; }
    public void setDependsOn(Set<String> dependsOn)              { this.dependsOn = dependsOn; }
    public void setParentId(String parentId)                     { this.parentId = parentId; }
    public void setChildren(List<String> children)               { this.children = children; }
    public void setFocus(String focus)                           { this.focus = focus; }
    public void setSubUnitsUsed(int subUnitsUsed)                { this.subUnitsUsed = subUnitsUsed; }
    public void setSplitMidItem(boolean splitMidItem)            { this.splitMidItem = splitMidItem; }
}
