package com.forgeloop.orchestrator.complexity;

import java.util.List;

/**
 * An item could not be split below the Complex threshold, even after one
 * re-request with feedback. The item's estimate is most likely wrong; this is
 * a configuration error for the operator, never silently accepted.
 */
public class DecompositionException extends RuntimeException {

    private final String itemId;
    private final List<String> violations;

    public DecompositionException(String itemId, List<String> violations) {
        super("Item " + itemId + " could not be decomposed: " + String.join("; ", violations));
        this.itemId     = itemId;
        this.violations = List.copyOf(violations);
    }

    public String       getItemId()     { return itemId; }
    public List<String> getViolations() { return violations; }
}
