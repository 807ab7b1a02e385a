package com.forgeloop.orchestrator.engine;

import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.model.PhaseState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Wall-clock budget per phase. Checked at phase boundaries and loop
 * iterations only, never by interrupting work in flight.
 */
@Component
public class TimeBudgetMonitor {

    private final ForgeloopProperties properties;
    private final Clock clock;

    public TimeBudgetMonitor(ForgeloopProperties properties, Clock clock) {
        this.properties = properties;
        this.clock      = clock;
    }

    public Duration budgetFor(PhaseState phase) {
        return properties.phaseBudget(phase.getCurrent()).plus(phase.getTimeExtension());
    }

    public Duration elapsed(PhaseState phase) {
        if (phase.getStartedAt() == null) return Duration.ZERO;
        return Duration.between(phase.getStartedAt(), clock.instant());
    }

    public boolean exceeded(PhaseState phase) {
        if (phase.isTimeGateWaived() || phase.getStartedAt() == null) {
            return false;
        }
        return elapsed(phase).compareTo(budgetFor(phase)) > 0;
    }
}
