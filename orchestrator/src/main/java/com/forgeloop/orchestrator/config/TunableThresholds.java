package com.forgeloop.orchestrator.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The live values of the thresholds the optimizer is allowed to tune.
 *
 * Initialised from {@link ForgeloopProperties}; changed only through
 * ThresholdApprovalService after an explicit approval.
 */
public class TunableThresholds {

    public static final String SIMPLE_MAX    = "complexity.simple-max";
    public static final String MEDIUM_MAX    = "complexity.medium-max";
    public static final String PROCEED_BELOW = "budget.proceed-below";
    public static final String CEILING       = "budget.ceiling";

    private long simpleMax;
    private long mediumMax;
    private long proceedBelow;
    private long ceiling;

    public TunableThresholds(long simpleMax, long mediumMax, long proceedBelow, long ceiling) {
        validate(simpleMax, mediumMax, proceedBelow, ceiling);
        this.simpleMax    = simpleMax;
        this.mediumMax    = mediumMax;
        this.proceedBelow = proceedBelow;
        this.ceiling      = ceiling;
    }

    public static TunableThresholds from(ForgeloopProperties props) {
        return new TunableThresholds(
                props.getComplexity().getSimpleMax(),
                props.getComplexity().getMediumMax(),
                props.getBudget().getProceedBelow(),
                props.getBudget().getCeiling());
    }

    public synchronized TunableThresholds copy() {
        return new TunableThresholds(simpleMax, mediumMax, proceedBelow, ceiling);
    }

    public synchronized long simpleMax()    { return simpleMax; }
    public synchronized long mediumMax()    { return mediumMax; }
    public synchronized long proceedBelow() { return proceedBelow; }
    public synchronized long ceiling()      { return ceiling; }

    public synchronized long get(String parameter) {
        return switch (parameter) {
            case SIMPLE_MAX    -> simpleMax;
            case MEDIUM_MAX    -> mediumMax;
            case PROCEED_BELOW -> proceedBelow;
            case CEILING       -> ceiling;
            default -> throw new IllegalArgumentException("Unknown threshold: " + parameter);
        };
    }

    /**
     * Replace one threshold. The ordering constraints between thresholds
     * (simple below medium, proceed below ceiling) must still hold.
     */
    public synchronized void set(String parameter, long value) {
        long s = simpleMax, m = mediumMax, p = proceedBelow, c = ceiling;
        switch (parameter) {
            case SIMPLE_MAX    -> s = value;
            case MEDIUM_MAX    -> m = value;
            case PROCEED_BELOW -> p = value;
            case CEILING       -> c = value;
            default -> throw new IllegalArgumentException("Unknown threshold: " + parameter);
        }
        validate(s, m, p, c);
        simpleMax = s; mediumMax = m; proceedBelow = p; ceiling = c;
    }

    public synchronized Map<String, Long> snapshot() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put(SIMPLE_MAX, simpleMax);
        values.put(MEDIUM_MAX, mediumMax);
        values.put(PROCEED_BELOW, proceedBelow);
        values.put(CEILING, ceiling);
        return values;
    }

    private static void validate(long simpleMax, long mediumMax, long proceedBelow, long ceiling) {
        if (simpleMax < 0 || simpleMax >= mediumMax) {
            throw new IllegalArgumentException(
                    "Require 0 <= simple-max < medium-max, got %d / %d".formatted(simpleMax, mediumMax));
        }
        if (proceedBelow <= 0 || proceedBelow >= ceiling) {
            throw new IllegalArgumentException(
                    "Require 0 < proceed-below < ceiling, got %d / %d".formatted(proceedBelow, ceiling));
        }
    }
}
