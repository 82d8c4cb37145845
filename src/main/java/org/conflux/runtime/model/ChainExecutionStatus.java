package org.conflux.runtime.model;

import java.util.List;

/**
 * Immutable view of a chain execution.
 *
 * @param chainId          The chain definition being executed.
 * @param executionId      This execution's id.
 * @param active           True while the execution can still make progress.
 * @param paused           True if the execution has been paused.
 * @param completed        True once every step completed.
 * @param failed           True once the execution failed or was cancelled.
 * @param errorMessage     Failure reason, or null.
 * @param startTime        Start time in epoch milliseconds.
 * @param currentStepIndex Index of the step being worked on, equal to the step count when completed.
 * @param recipeIds        Recipe ids of the chain, in order.
 * @param stepStatus       Per-step status.
 * @param progress         Overall progress in [0, 1].
 */
public record ChainExecutionStatus(
        String chainId,
        ChainExecutionId executionId,
        boolean active,
        boolean paused,
        boolean completed,
        boolean failed,
        String errorMessage,
        long startTime,
        int currentStepIndex,
        List<String> recipeIds,
        List<StepStatus> stepStatus,
        double progress
) {

    public ChainExecutionStatus {
        recipeIds = List.copyOf(recipeIds);
        stepStatus = List.copyOf(stepStatus);
    }

    public boolean isFinished() {
        return completed || failed;
    }
}
