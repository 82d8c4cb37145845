package org.conflux.runtime.api;

import java.util.List;
import java.util.Map;

/**
 * Monitoring surface of the conversion engine: counters, the bounded log of transient errors and
 * a health flag derived from both.
 */
public interface IMonitorable {

    /**
     * Current counters keyed by metric name, e.g. {@code active_processes} or
     * {@code completed_chains}.
     */
    Map<String, Number> getMetrics();

    /**
     * Transient errors recorded since the last {@link #clearErrors()}, oldest first. Only the most
     * recent errors are kept.
     */
    List<OperationalError> getErrors();

    /**
     * Forgets every recorded error, typically after an operator has looked at them.
     */
    void clearErrors();

    /**
     * @return false while the engine runs without a converter directory or has unacknowledged
     *         errors
     */
    boolean isHealthy();
}
