package org.conflux.runtime.model;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * One in-flight execution of a single recipe on a single converter.
 * <p>
 * Instances are owned by the engine. While active they sit in the scheduler's processing queue;
 * once completed they are kept only in the bounded completed-process history. Callers outside the
 * engine only ever see {@link ProcessSnapshot}s.
 * <p>
 * Thread Safety: not thread-safe, confined to the engine's monitor.
 */
public final class ConversionProcess {

    private final ProcessId processId;
    private final String recipeId;
    private final String sourceId;
    private final long startTime;
    private final ChainExecutionId chainExecutionId;

    private boolean active = true;
    private boolean paused = false;
    private Long endTime;
    private double progress = 0.0;
    private Double appliedEfficiency;
    private long pausedSince = -1L;
    private long pausedMillis = 0L;

    public ConversionProcess(ProcessId processId, String recipeId, String sourceId, long startTime,
                             ChainExecutionId chainExecutionId) {
        this.processId = processId;
        this.recipeId = recipeId;
        this.sourceId = sourceId;
        this.startTime = startTime;
        this.chainExecutionId = chainExecutionId;
    }

    /**
     * Recomputes progress for the given wall-clock time. Time spent paused is excluded and progress
     * never decreases.
     *
     * @param now              current time in epoch milliseconds
     * @param processingTimeMs the recipe's processing time
     * @return the updated progress in [0, 1]
     */
    public double advance(long now, long processingTimeMs) {
        if (!active || paused) {
            return progress;
        }
        double computed;
        if (processingTimeMs <= 0) {
            computed = 1.0;
        } else {
            long elapsed = now - startTime - pausedMillis;
            computed = Math.min(1.0, Math.max(0.0, (double) elapsed / processingTimeMs));
        }
        if (computed > progress) {
            progress = computed;
        }
        return progress;
    }

    public boolean pause(long now) {
        if (!active || paused) {
            return false;
        }
        paused = true;
        pausedSince = now;
        return true;
    }

    public boolean resume(long now) {
        if (!active || !paused) {
            return false;
        }
        paused = false;
        if (pausedSince >= 0) {
            pausedMillis += Math.max(0L, now - pausedSince);
        }
        pausedSince = -1L;
        return true;
    }

    /**
     * Marks the process finished with full progress.
     */
    public void complete(long now) {
        active = false;
        paused = false;
        progress = 1.0;
        endTime = now;
    }

    /**
     * Stops the process without completing it.
     */
    public void abort(long now) {
        active = false;
        paused = false;
        endTime = now;
    }

    public void applyEfficiency(double efficiency) {
        this.appliedEfficiency = efficiency;
    }

    public ProcessId getProcessId() {
        return processId;
    }

    public String getRecipeId() {
        return recipeId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public long getStartTime() {
        return startTime;
    }

    public Optional<ChainExecutionId> getChainExecutionId() {
        return Optional.ofNullable(chainExecutionId);
    }

    public boolean isActive() {
        return active;
    }

    public boolean isPaused() {
        return paused;
    }

    public OptionalLong getEndTime() {
        return endTime == null ? OptionalLong.empty() : OptionalLong.of(endTime);
    }

    public double getProgress() {
        return progress;
    }

    public OptionalDouble getAppliedEfficiency() {
        return appliedEfficiency == null ? OptionalDouble.empty() : OptionalDouble.of(appliedEfficiency);
    }

    public ProcessSnapshot snapshot() {
        return new ProcessSnapshot(processId, recipeId, sourceId, active, paused, startTime,
                endTime, progress, appliedEfficiency == null ? 0.0 : appliedEfficiency, chainExecutionId);
    }

    @Override
    public String toString() {
        return "ConversionProcess{" + processId + ", recipe=" + recipeId + ", converter=" + sourceId
                + ", progress=" + progress + ", active=" + active + ", paused=" + paused + '}';
    }
}
