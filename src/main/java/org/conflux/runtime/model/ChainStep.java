package org.conflux.runtime.model;

import java.util.Optional;

/**
 * Runtime record of one step of a chain execution.
 * <p>
 * Status changes go through {@link #transitionTo(ProcessStatus, long)}, which rejects any move that
 * would revisit or skip a state.
 */
public final class ChainStep {

    private final String recipeId;
    private ProcessStatus status = ProcessStatus.PENDING;
    private long startTime;
    private long endTime;
    private ProcessId processId;
    private String converterId;

    public ChainStep(String recipeId) {
        this.recipeId = recipeId;
    }

    /**
     * Moves the step to {@code IN_PROGRESS} for the given process and converter.
     */
    public void start(ProcessId processId, String converterId, long now) {
        transitionTo(ProcessStatus.IN_PROGRESS, now);
        this.processId = processId;
        this.converterId = converterId;
        this.startTime = now;
    }

    public void complete(long now) {
        transitionTo(ProcessStatus.COMPLETED, now);
        this.endTime = now;
    }

    public void fail(long now) {
        transitionTo(ProcessStatus.FAILED, now);
        this.endTime = now;
    }

    /**
     * Records the converter chosen ahead of time for a step that has not started yet.
     */
    public void assignConverter(String converterId) {
        if (status != ProcessStatus.PENDING) {
            throw new IllegalStateException("Cannot assign a converter to a step in status " + status);
        }
        this.converterId = converterId;
    }

    private void transitionTo(ProcessStatus next, long now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("Illegal step transition %s -> %s for recipe %s at %d", status, next, recipeId, now));
        }
        this.status = next;
    }

    public String getRecipeId() {
        return recipeId;
    }

    public ProcessStatus getStatus() {
        return status;
    }

    public Optional<ProcessId> getProcessId() {
        return Optional.ofNullable(processId);
    }

    public Optional<String> getConverterId() {
        return Optional.ofNullable(converterId);
    }

    public StepStatus snapshot() {
        return new StepStatus(recipeId, status, startTime, endTime, processId, converterId);
    }
}
