package org.conflux.runtime.services;

import org.conflux.runtime.api.OperationalError;

import java.time.Clock;
import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded collection of transient errors. When the limit is exceeded, the oldest errors are
 * removed.
 * <p>
 * Thread Safety: not thread-safe, confined to the engine's monitor.
 */
public class OperationalErrorLog {

    private final Deque<OperationalError> errors = new ArrayDeque<>();
    private final int maxErrors;
    private final Clock clock;

    public OperationalErrorLog(int maxErrors, Clock clock) {
        this.maxErrors = Math.max(0, maxErrors);
        this.clock = clock;
    }

    /**
     * Records an operational error for tracking and monitoring.
     *
     * @param code    Error code for categorization (e.g., "NODE_UPDATE_FAILURE")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    public void record(String code, String message, String details) {
        errors.addLast(new OperationalError(clock.instant(), code, message, details));
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    public List<OperationalError> snapshot() {
        return new ArrayList<>(errors);
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public void clear() {
        errors.clear();
    }
}
