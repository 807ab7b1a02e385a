package com.forgeloop.orchestrator.engine;

/**
 * An item may not be scheduled directly: its category is COMPLEX or its
 * estimated resource is above the ceiling. The item must be decomposed.
 */
public class ResourceCeilingExceededException extends RuntimeException {

    private final String itemId;
    private final long estimatedResource;
    private final long ceiling;

    public ResourceCeilingExceededException(String itemId, long estimatedResource, long ceiling, String reason) {
        super("Item %s refused for direct scheduling (estimate %d, ceiling %d): %s"
                .formatted(itemId, estimatedResource, ceiling, reason));
        this.itemId            = itemId;
        this.estimatedResource = estimatedResource;
        this.ceiling           = ceiling;
    }

    public String getItemId()            { return itemId; }
    public long   getEstimatedResource() { return estimatedResource; }
    public long   getCeiling()           { return ceiling; }
}
