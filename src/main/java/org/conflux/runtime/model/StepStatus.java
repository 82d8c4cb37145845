package org.conflux.runtime.model;

/**
 * Immutable view of a chain step.
 *
 * @param recipeId    Recipe executed by the step.
 * @param status      Current status.
 * @param startTime   Time the step's process started, 0 if not started.
 * @param endTime     Time the step finished, 0 if not finished.
 * @param processId   The step's process, or null before start.
 * @param converterId Converter running (or pre-selected for) the step, or null.
 */
public record StepStatus(
        String recipeId,
        ProcessStatus status,
        long startTime,
        long endTime,
        ProcessId processId,
        String converterId
) {
}
