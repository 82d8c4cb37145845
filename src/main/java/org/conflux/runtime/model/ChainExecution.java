package org.conflux.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Mutable runtime state of one execution of a {@link ConversionChain}.
 * <p>
 * Only the chain executor and the transfer coordinator mutate instances; everything else sees
 * {@link ChainExecutionStatus} snapshots.
 * <p>
 * Thread Safety: not thread-safe, confined to the engine's monitor.
 */
public final class ChainExecution {

    private final String chainId;
    private final ChainExecutionId executionId;
    private final long startTime;
    private final List<String> recipeIds;
    private final List<ChainStep> steps;

    private boolean active = true;
    private boolean paused = false;
    private boolean completed = false;
    private boolean failed = false;
    private String errorMessage;
    private long endTime;
    private int currentStepIndex = 0;

    public ChainExecution(ConversionChain chain, ChainExecutionId executionId, long startTime) {
        this.chainId = chain.id();
        this.executionId = executionId;
        this.startTime = startTime;
        this.recipeIds = List.copyOf(chain.steps());
        List<ChainStep> created = new ArrayList<>(recipeIds.size());
        for (String recipeId : recipeIds) {
            created.add(new ChainStep(recipeId));
        }
        this.steps = Collections.unmodifiableList(created);
    }

    /**
     * True while the execution is active and has neither completed nor failed.
     */
    public boolean isRunning() {
        return active && !completed && !failed;
    }

    public boolean isFinished() {
        return completed || failed;
    }

    public Optional<ChainStep> currentStep() {
        if (currentStepIndex < 0 || currentStepIndex >= steps.size()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(currentStepIndex));
    }

    public Optional<ChainStep> step(int index) {
        if (index < 0 || index >= steps.size()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(index));
    }

    /**
     * Returns the index of the step running the given process, or -1.
     */
    public int indexOfProcess(ProcessId processId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getProcessId().map(processId::equals).orElse(false)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Moves to the next step. Returns true if every step has now been completed.
     */
    public boolean advanceStep() {
        currentStepIndex++;
        return currentStepIndex >= recipeIds.size();
    }

    public void markCompleted(long now) {
        this.completed = true;
        this.active = false;
        this.paused = false;
        this.endTime = now;
    }

    public void markFailed(String message, long now) {
        this.failed = true;
        this.active = false;
        this.paused = false;
        this.errorMessage = message;
        this.endTime = now;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    /**
     * Overall progress: completed steps count fully, the in-progress step by its process progress.
     *
     * @param processProgress looks up the current progress of a step's process
     */
    public double progress(ToDoubleFunction<ProcessId> processProgress) {
        if (steps.isEmpty()) {
            return completed ? 1.0 : 0.0;
        }
        double total = 0.0;
        for (ChainStep step : steps) {
            if (step.getStatus() == ProcessStatus.COMPLETED) {
                total += 1.0;
            } else if (step.getStatus() == ProcessStatus.IN_PROGRESS && step.getProcessId().isPresent()) {
                total += processProgress.applyAsDouble(step.getProcessId().get());
            }
        }
        return total / steps.size();
    }

    public ChainExecutionStatus snapshot(ToDoubleFunction<ProcessId> processProgress) {
        List<StepStatus> stepStatus = new ArrayList<>(steps.size());
        for (ChainStep step : steps) {
            stepStatus.add(step.snapshot());
        }
        return new ChainExecutionStatus(chainId, executionId, active, paused, completed, failed, errorMessage,
                startTime, currentStepIndex, recipeIds, stepStatus, progress(processProgress));
    }

    public String getChainId() {
        return chainId;
    }

    public ChainExecutionId getExecutionId() {
        return executionId;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public List<String> getRecipeIds() {
        return recipeIds;
    }

    public List<ChainStep> getSteps() {
        return steps;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isFailed() {
        return failed;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }
}
