package org.conflux.runtime;

import com.typesafe.config.Config;

import java.util.concurrent.TimeUnit;

/**
 * Tunables of a {@link ConversionEngine}, read from the {@code conflux.engine} configuration
 * block.
 *
 * @param tickIntervalMs    Interval between scheduler ticks in milliseconds.
 * @param maxProcessHistory Completed processes kept for queries.
 * @param maxChainHistory   Finished chain executions kept for queries.
 * @param maxErrors         Operational errors kept for monitoring.
 */
public record EngineOptions(long tickIntervalMs, int maxProcessHistory, int maxChainHistory, int maxErrors) {

    public static final String CONFIG_PATH = "conflux.engine";

    public EngineOptions {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tick-interval must be positive, got " + tickIntervalMs + " ms");
        }
        if (maxProcessHistory < 0) {
            throw new IllegalArgumentException("max-process-history must not be negative, got " + maxProcessHistory);
        }
        if (maxChainHistory < 0) {
            throw new IllegalArgumentException("max-chain-history must not be negative, got " + maxChainHistory);
        }
        if (maxErrors < 0) {
            throw new IllegalArgumentException("max-errors must not be negative, got " + maxErrors);
        }
    }

    public static EngineOptions defaults() {
        return new EngineOptions(org.conflux.runtime.Config.DEFAULT_TICK_INTERVAL_MS,
                org.conflux.runtime.Config.DEFAULT_MAX_PROCESS_HISTORY,
                org.conflux.runtime.Config.DEFAULT_MAX_CHAIN_HISTORY,
                org.conflux.runtime.Config.DEFAULT_MAX_ERRORS);
    }

    /**
     * Reads options from the {@code conflux.engine} block of {@code config}. Missing keys fall back
     * to the defaults.
     *
     * @throws IllegalArgumentException if a value is out of range
     * @throws com.typesafe.config.ConfigException.WrongType if a value has the wrong type
     */
    public static EngineOptions fromConfig(Config config) {
        EngineOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config engine = config.getConfig(CONFIG_PATH);
        long tickInterval = engine.hasPath("tick-interval")
                ? engine.getDuration("tick-interval", TimeUnit.MILLISECONDS)
                : defaults.tickIntervalMs();
        int processHistory = engine.hasPath("max-process-history")
                ? engine.getInt("max-process-history")
                : defaults.maxProcessHistory();
        int chainHistory = engine.hasPath("max-chain-history")
                ? engine.getInt("max-chain-history")
                : defaults.maxChainHistory();
        int errors = engine.hasPath("max-errors")
                ? engine.getInt("max-errors")
                : defaults.maxErrors();
        return new EngineOptions(tickInterval, processHistory, chainHistory, errors);
    }

    public EngineOptions withTickInterval(long tickIntervalMs) {
        return new EngineOptions(tickIntervalMs, maxProcessHistory, maxChainHistory, maxErrors);
    }
}
