package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.model.ResourceTracking;
import com.forgeloop.orchestrator.model.WorkItem;
import org.springframework.stereotype.Component;

/**
 * Resource accounting rules.
 *
 * Within a session {@code used} only grows. It may exceed the budget;
 * {@code thresholdExceeded} is true exactly when used / budget is above the
 * warning ratio. A new session starts from zero; the cumulative counter
 * carries on.
 */
@Component
public class ResourceLedger {

    private final ForgeloopProperties.Budget budget;

    public ResourceLedger(ForgeloopProperties properties) {
        this.budget = properties.getBudget();
    }

    public void startSession(ResourceTracking tracking, String sessionId) {
        tracking.setSessionId(sessionId);
        tracking.setBudget(budget.getSessionBudget());
        tracking.setUsed(0);
        tracking.setLastUnitCost(0);
        tracking.setThresholdExceeded(false);
    }

    public void trackResourceUsage(ResourceTracking tracking, long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Resource cost must not be negative: " + cost);
        }
        tracking.setUsed(tracking.getUsed() + cost);
        tracking.setLastUnitCost(cost);
        tracking.setCumulativeUsed(tracking.getCumulativeUsed() + cost);
        tracking.setThresholdExceeded(approachingLimit(tracking.getUsed(), tracking.getBudget()));
    }

    public boolean approachingLimit(long used, long sessionBudget) {
        if (sessionBudget <= 0) {
            return used > 0;
        }
        return (double) used / sessionBudget > budget.getSessionWarnRatio();
    }

    /** Usage above which an unfinished item is stopped and its remainder split off. */
    public long itemCeiling() {
        return (long) Math.floor(budget.getPerAgentCeiling() * budget.getItemCeilingRatio());
    }

    public boolean itemOverCeiling(WorkItem item) {
        return item.getActualResource() > itemCeiling();
    }
}
