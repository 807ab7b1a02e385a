package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.config.TunableThresholds;
import com.forgeloop.orchestrator.model.ComplexityCategory;
import com.forgeloop.orchestrator.model.WorkItem;
import org.springframework.stereotype.Component;

/**
 * Scheduling precondition applied to every item before implementation.
 *
 * <pre>
 *   estimate &lt;  proceedBelow             → 1 sub-unit
 *   proceedBelow ≤ estimate ≤ midpoint    → 2 sub-units
 *   midpoint &lt; estimate ≤ ceiling         → 3 sub-units
 *   estimate &gt;  ceiling, or COMPLEX       → refused, must be decomposed
 * </pre>
 */
@Component
public class BudgetLadder {

    private final TunableThresholds thresholds;

    public BudgetLadder(TunableThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @throws ResourceCeilingExceededException if the item must not be scheduled directly
     * @throws IllegalStateException if the item has not been scored
     */
    public SchedulingPlan plan(WorkItem item) {
        if (!item.isScored()) {
            throw new IllegalStateException("Item " + item.getId() + " has not been scored");
        }
        long estimate     = item.getEstimatedResource();
        long proceedBelow = thresholds.proceedBelow();
        long ceiling      = thresholds.ceiling();

        if (item.getComplexityCategory() == ComplexityCategory.COMPLEX) {
            throw new ResourceCeilingExceededException(item.getId(), estimate, ceiling,
                    "complexity score " + item.getComplexityScore() + " is COMPLEX");
        }
        if (estimate > ceiling) {
            throw new ResourceCeilingExceededException(item.getId(), estimate, ceiling,
                    "estimate above the resource ceiling");
        }
        if (estimate < proceedBelow) {
            return new SchedulingPlan(item.getId(), estimate, 1);
        }
        long midpoint = proceedBelow + (ceiling - proceedBelow) / 2;
        return new SchedulingPlan(item.getId(), estimate, estimate <= midpoint ? 2 : 3);
    }
}
