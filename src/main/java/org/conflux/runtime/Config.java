package org.conflux.runtime;

/**
 * Provides the fixed tuning constants of the conversion engine.
 * Values that operators are expected to change live in {@code reference.conf}
 * and are read through {@link EngineOptions}.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * Lower bound of the efficiency multiplier applied to process outputs.
     */
    public static final double MIN_APPLIED_EFFICIENCY = 0.0;

    /**
     * Upper bound of the efficiency multiplier applied to process outputs (200%).
     */
    public static final double MAX_APPLIED_EFFICIENCY = 2.0;

    /**
     * Efficiency lost by a converter running at full capacity.
     */
    public static final double MAX_STRESS_PENALTY = 0.2;

    /**
     * The network stress factor never drops below this value.
     */
    public static final double MIN_STRESS_FACTOR = 0.5;

    /**
     * Factor applied for input quality. Inputs carry no quality attribute yet.
     */
    public static final double NEUTRAL_QUALITY_FACTOR = 1.0;

    /**
     * Default interval between two scheduler ticks in milliseconds.
     */
    public static final long DEFAULT_TICK_INTERVAL_MS = 1000L;

    /**
     * Default size of the completed-process history.
     */
    public static final int DEFAULT_MAX_PROCESS_HISTORY = 1000;

    /**
     * Default number of finished chain executions kept for inspection.
     */
    public static final int DEFAULT_MAX_CHAIN_HISTORY = 100;

    /**
     * Default size of the operational error buffer.
     */
    public static final int DEFAULT_MAX_ERRORS = 1000;

    /**
     * Clamps a raw efficiency into the applied range.
     *
     * @param efficiency the raw efficiency
     * @return the efficiency limited to [{@link #MIN_APPLIED_EFFICIENCY}, {@link #MAX_APPLIED_EFFICIENCY}]
     */
    public static double clampEfficiency(double efficiency) {
        if (Double.isNaN(efficiency)) {
            return MIN_APPLIED_EFFICIENCY;
        }
        return Math.max(MIN_APPLIED_EFFICIENCY, Math.min(efficiency, MAX_APPLIED_EFFICIENCY));
    }
}
