package org.conflux.runtime.model;

/**
 * Immutable view of a {@link ConversionProcess} at the time it was taken.
 *
 * @param processId          Process id.
 * @param recipeId           Recipe being executed.
 * @param sourceId           Converter running the process.
 * @param active             Whether the process is still running.
 * @param paused             Whether the process is paused.
 * @param startTime          Start time in epoch milliseconds.
 * @param endTime            End time in epoch milliseconds, or null while running.
 * @param progress           Progress in [0, 1].
 * @param appliedEfficiency  Efficiency captured at start, in [0, 2].
 * @param chainExecutionId   Owning chain execution, or null for ad-hoc processes.
 */
public record ProcessSnapshot(
        ProcessId processId,
        String recipeId,
        String sourceId,
        boolean active,
        boolean paused,
        long startTime,
        Long endTime,
        double progress,
        double appliedEfficiency,
        ChainExecutionId chainExecutionId
) {
}
