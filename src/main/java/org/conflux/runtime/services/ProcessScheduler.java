package org.conflux.runtime.services;

import org.conflux.runtime.model.ConversionProcess;
import org.conflux.runtime.model.ProcessId;
import org.conflux.runtime.model.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns the processing queue and drives it with a fixed-interval timer.
 * <p>
 * Each {@link #sweep} visits the processes that were queued when the sweep began, in queue order,
 * advances their progress and hands every process that reached 100% to the completion routine.
 * Processes queued during a sweep (for example by a chain advancing to its next step) are first
 * visited on the following tick, so starting a process never completes it synchronously.
 * <p>
 * The sweep itself is not thread-safe; the owner must serialize {@link #sweep} with every other
 * access. The timer only invokes the tick action supplied to {@link #start}.
 */
public class ProcessScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessScheduler.class);

    private final List<ConversionProcess> queue = new ArrayList<>();
    private final Map<ProcessId, ConversionProcess> activeById = new HashMap<>();
    private final Deque<ConversionProcess> completedHistory = new ArrayDeque<>();
    private final int maxHistorySize;
    private final AtomicLong tickCount = new AtomicLong(0);

    private ScheduledExecutorService timer;
    private volatile boolean running = false;

    public ProcessScheduler(int maxHistorySize) {
        this.maxHistorySize = Math.max(0, maxHistorySize);
    }

    /**
     * Starts the timer. Each timer firing runs {@code tickAction}; an exception thrown by one tick
     * is logged and does not stop the timer.
     *
     * @param intervalMs interval between ticks in milliseconds
     * @param tickAction the work to run on every tick
     */
    public synchronized void start(long intervalMs, Runnable tickAction) {
        if (running) {
            throw new IllegalStateException("Process scheduler is already running");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Tick interval must be > 0 but was " + intervalMs);
        }
        running = true;
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "conflux-process-scheduler");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(() -> {
            if (!running) {
                return;
            }
            try {
                tickAction.run();
            } catch (RuntimeException e) {
                LOG.error("Tick {} failed with {}: {}", tickCount.get(), e.getClass().getSimpleName(), e.getMessage());
                LOG.debug("Tick failure details:", e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Process scheduler started with a tick interval of {} ms", intervalMs);
    }

    /**
     * Stops the timer. Queued processes are left untouched.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        timer.shutdown();
        try {
            if (!timer.awaitTermination(2, TimeUnit.SECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timer = null;
        LOG.info("Process scheduler stopped after {} ticks", tickCount.get());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Adds a started process to the end of the queue.
     */
    public void enqueue(ConversionProcess process) {
        queue.add(process);
        activeById.put(process.getProcessId(), process);
    }

    /**
     * Advances every queued process once.
     *
     * @param now          current time in epoch milliseconds
     * @param recipeLookup resolves a process's recipe to obtain its processing time
     * @param onComplete   completion routine for processes that reached 100%
     * @return the number of processes completed by this sweep
     */
    public int sweep(long now, Function<String, Optional<Recipe>> recipeLookup, Consumer<ConversionProcess> onComplete) {
        tickCount.incrementAndGet();
        int completed = 0;
        List<ConversionProcess> batch = new ArrayList<>(queue);
        for (ConversionProcess process : batch) {
            if (!process.isActive() || process.isPaused()) {
                continue;
            }
            Optional<Recipe> recipe = recipeLookup.apply(process.getRecipeId());
            double progress = recipe
                    .map(r -> process.advance(now, r.processingTimeMs()))
                    .orElse(1.0);
            if (progress >= 1.0) {
                remove(process.getProcessId());
                onComplete.accept(process);
                addToHistory(process);
                completed++;
            }
        }
        trimHistory();
        return completed;
    }

    /**
     * Removes a process from the queue without completing it and records it in the history.
     *
     * @return the removed process, or empty if it was not queued
     */
    public Optional<ConversionProcess> dequeue(ProcessId processId) {
        Optional<ConversionProcess> removed = remove(processId);
        removed.ifPresent(p -> {
            addToHistory(p);
            trimHistory();
        });
        return removed;
    }

    public Optional<ConversionProcess> findActive(ProcessId processId) {
        return Optional.ofNullable(activeById.get(processId));
    }

    /**
     * Looks a process up in the queue first, then in the completed history.
     */
    public Optional<ConversionProcess> find(ProcessId processId) {
        ConversionProcess active = activeById.get(processId);
        if (active != null) {
            return Optional.of(active);
        }
        for (ConversionProcess process : completedHistory) {
            if (process.getProcessId().equals(processId)) {
                return Optional.of(process);
            }
        }
        return Optional.empty();
    }

    public List<ConversionProcess> getQueue() {
        return new ArrayList<>(queue);
    }

    public List<ConversionProcess> getCompletedHistory() {
        return new ArrayList<>(completedHistory);
    }

    public int queueSize() {
        return queue.size();
    }

    public int historySize() {
        return completedHistory.size();
    }

    public long getTickCount() {
        return tickCount.get();
    }

    /**
     * Drops every queued and completed process.
     */
    public void clear() {
        queue.clear();
        activeById.clear();
        completedHistory.clear();
    }

    private Optional<ConversionProcess> remove(ProcessId processId) {
        ConversionProcess process = activeById.remove(processId);
        if (process != null) {
            queue.remove(process);
        }
        return Optional.ofNullable(process);
    }

    private void addToHistory(ConversionProcess process) {
        completedHistory.addLast(process);
    }

    private void trimHistory() {
        while (completedHistory.size() > maxHistorySize) {
            completedHistory.pollFirst();
        }
    }
}
