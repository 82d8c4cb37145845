package org.conflux.runtime.services;

import org.conflux.runtime.api.ConversionResult;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ChainExecution;
import org.conflux.runtime.model.ChainExecutionId;
import org.conflux.runtime.model.ChainExecutionStatus;
import org.conflux.runtime.model.ChainStep;
import org.conflux.runtime.model.ConversionChain;
import org.conflux.runtime.model.ConversionProcess;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.ProcessId;
import org.conflux.runtime.model.ProcessStatus;
import org.conflux.runtime.model.ResourceAmount;
import org.conflux.runtime.spi.IEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Drives chain executions through their steps.
 * <p>
 * A step starts on the first eligible converter with spare capacity, preferring the converter
 * pre-selected when the previous step completed. If no eligible converter has capacity the step
 * stays pending until the next process completion or an explicit retry pokes it again. A chain
 * whose recipe has no supporting converter at all, or whose step fails to start, fails
 * permanently.
 * <p>
 * Finished executions are kept in a bounded history; the oldest finished execution is evicted
 * first and running or paused executions are never evicted.
 * <p>
 * Thread Safety: not thread-safe, confined to the engine's monitor.
 */
public class ChainExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ChainExecutor.class);

    private final RecipeRegistry registry;
    private final DirectoryGateway directory;
    private final ProcessLauncher launcher;
    private final ProcessScheduler scheduler;
    private final IEventSink events;
    private final OperationalErrorLog errors;
    private final Clock clock;
    private final int maxChainHistory;

    private final Map<ChainExecutionId, ChainExecution> executions = new LinkedHashMap<>();
    private final Deque<ChainExecutionId> finishedOrder = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private long completedCount = 0;
    private long failedCount = 0;

    public ChainExecutor(RecipeRegistry registry, DirectoryGateway directory, ProcessLauncher launcher,
                         ProcessScheduler scheduler, IEventSink events, OperationalErrorLog errors, Clock clock,
                         int maxChainHistory) {
        this.registry = registry;
        this.directory = directory;
        this.launcher = launcher;
        this.scheduler = scheduler;
        this.events = events;
        this.errors = errors;
        this.clock = clock;
        this.maxChainHistory = Math.max(0, maxChainHistory);
    }

    /**
     * Creates an execution of the registered chain and tries to start its first step.
     *
     * @param chainId the chain to run
     * @return the new execution id, or empty if no chain with that id is registered
     */
    public Optional<ChainExecutionId> start(String chainId) {
        Optional<ConversionChain> chain = registry.findChain(chainId);
        if (chain.isEmpty()) {
            LOG.warn("Cannot start chain {}: not registered", chainId);
            return Optional.empty();
        }
        ChainExecutionId executionId = new ChainExecutionId("chain-exec-" + chainId + "-" + sequence.incrementAndGet());
        ChainExecution execution = new ChainExecution(chain.get(), executionId, clock.millis());
        executions.put(executionId, execution);
        LOG.info("Started chain {} as {} with {} step(s)", chainId, executionId, execution.getRecipeIds().size());

        processNextStep(execution);
        return Optional.of(executionId);
    }

    /**
     * Tries to start the current step of a running execution.
     */
    void processNextStep(ChainExecution execution) {
        if (!execution.isRunning() || execution.isPaused()) {
            return;
        }
        long now = clock.millis();
        if (execution.getCurrentStepIndex() >= execution.getRecipeIds().size()) {
            complete(execution, List.of(), now);
            return;
        }
        ChainStep step = execution.currentStep().orElseThrow();
        if (step.getStatus() != ProcessStatus.PENDING) {
            return;
        }
        String recipeId = step.getRecipeId();
        List<ConverterNode> eligible = List.of();
        if (registry.findRecipe(recipeId).isEmpty()) {
            LOG.debug("Chain {} step {}: recipe {} is not registered",
                    execution.getExecutionId(), execution.getCurrentStepIndex(), recipeId);
        } else if (!directory.isBound()) {
            LOG.debug("Chain {} step {}: no converter directory bound",
                    execution.getExecutionId(), execution.getCurrentStepIndex());
        } else {
            eligible = eligibleConverters(recipeId);
        }
        if (eligible.isEmpty()) {
            fail(execution, "No converters available for recipe " + recipeId);
            return;
        }
        Optional<ConverterNode> selected = selectConverter(eligible, step.getConverterId().orElse(null));
        if (selected.isEmpty()) {
            LOG.debug("Chain {} waiting for a free converter for step {} ({})",
                    execution.getExecutionId(), execution.getCurrentStepIndex(), recipeId);
            return;
        }

        String converterId = selected.get().id();
        ConversionResult result = launcher.start(converterId, recipeId, execution.getExecutionId());
        if (!result.success()) {
            String message = result.getError()
                    .map(e -> e.message())
                    .orElse("Failed to start conversion process for recipe " + recipeId);
            fail(execution, message);
            return;
        }

        ProcessId processId = result.getProcessId().orElseThrow();
        step.start(processId, converterId, now);
        LOG.debug("Chain {} step {} ({}) started as {} on {}",
                execution.getExecutionId(), execution.getCurrentStepIndex(), recipeId, processId, converterId);
        events.publish(new EngineEvent.ChainStepStarted(now, execution.getChainId(), execution.getExecutionId(),
                execution.getCurrentStepIndex(), recipeId, processId, converterId));
        publishStatus(execution, now);
    }

    /**
     * Picks the converter for the step following the one run by {@code process} and records it on
     * that still-pending step.
     *
     * @return the next step's converter id, or empty if the process is not part of a running,
     *         unpaused chain, ran the last step, or no eligible converter has spare capacity right now
     */
    public Optional<String> resolveNextConverter(ConversionProcess process) {
        Optional<ChainExecution> execution = owningExecution(process);
        if (execution.isEmpty() || !execution.get().isRunning() || execution.get().isPaused()) {
            return Optional.empty();
        }
        int index = execution.get().indexOfProcess(process.getProcessId());
        if (index < 0) {
            return Optional.empty();
        }
        Optional<ChainStep> next = execution.get().step(index + 1);
        if (next.isEmpty() || next.get().getStatus() != ProcessStatus.PENDING) {
            return Optional.empty();
        }
        Optional<String> assigned = next.get().getConverterId();
        if (assigned.isPresent()) {
            return assigned;
        }
        Optional<ConverterNode> selected = selectConverter(eligibleConverters(next.get().getRecipeId()), null);
        selected.ifPresent(node -> next.get().assignConverter(node.id()));
        return selected.map(ConverterNode::id);
    }

    /**
     * Completes the chain step run by {@code process} and advances its execution.
     *
     * @param outputs    the efficiency-adjusted outputs of the process
     * @param efficiency the applied efficiency
     */
    public void onStepCompleted(ConversionProcess process, List<ResourceAmount> outputs, double efficiency) {
        Optional<ChainExecution> owner = owningExecution(process);
        if (owner.isEmpty() || !owner.get().isRunning()) {
            return;
        }
        ChainExecution execution = owner.get();
        int index = execution.indexOfProcess(process.getProcessId());
        if (index < 0) {
            LOG.warn("Process {} is not a step of chain execution {}", process.getProcessId(), execution.getExecutionId());
            return;
        }
        ChainStep step = execution.step(index).orElseThrow();
        if (step.getStatus() != ProcessStatus.IN_PROGRESS) {
            return;
        }
        long now = clock.millis();
        step.complete(now);
        events.publish(new EngineEvent.ChainStepCompleted(now, execution.getChainId(), execution.getExecutionId(),
                index, process.getProcessId(), step.getRecipeId(), process.getSourceId(), outputs, efficiency));

        if (execution.advanceStep()) {
            complete(execution, outputs, now);
            return;
        }
        publishStatus(execution, now);
        processNextStep(execution);
    }

    /**
     * Fails the chain owning {@code process} because the process could not be completed.
     */
    public void onStepFailed(ConversionProcess process, String message) {
        Optional<ChainExecution> owner = owningExecution(process);
        if (owner.isEmpty() || !owner.get().isRunning()) {
            return;
        }
        int index = owner.get().indexOfProcess(process.getProcessId());
        owner.get().step(index)
                .filter(s -> s.getStatus() == ProcessStatus.IN_PROGRESS)
                .ifPresent(s -> s.fail(clock.millis()));
        fail(owner.get(), message);
    }

    /**
     * Pokes every running, unpaused execution whose current step is still waiting for a converter,
     * in start order.
     */
    public void repokeWaiting() {
        for (ChainExecution execution : new ArrayList<>(executions.values())) {
            if (execution.isRunning() && !execution.isPaused()
                    && execution.currentStep().map(s -> s.getStatus() == ProcessStatus.PENDING).orElse(false)) {
                processNextStep(execution);
            }
        }
    }

    /**
     * Re-pokes step start for one execution.
     *
     * @return false if the execution is unknown, finished or paused
     */
    public boolean retry(ChainExecutionId executionId) {
        ChainExecution execution = executions.get(executionId);
        if (execution == null || !execution.isRunning() || execution.isPaused()) {
            return false;
        }
        processNextStep(execution);
        return true;
    }

    public boolean pause(ChainExecutionId executionId) {
        ChainExecution execution = executions.get(executionId);
        if (execution == null || !execution.isRunning() || execution.isPaused()) {
            return false;
        }
        long now = clock.millis();
        execution.setPaused(true);
        inFlightProcess(execution).ifPresent(process -> {
            if (process.pause(now)) {
                events.publish(new EngineEvent.ProcessUpdated(now, process.snapshot()));
            }
        });
        LOG.info("Paused chain execution {}", executionId);
        publishStatus(execution, now);
        return true;
    }

    public boolean resume(ChainExecutionId executionId) {
        ChainExecution execution = executions.get(executionId);
        if (execution == null || !execution.isRunning() || !execution.isPaused()) {
            return false;
        }
        long now = clock.millis();
        execution.setPaused(false);
        inFlightProcess(execution).ifPresent(process -> {
            if (process.resume(now)) {
                events.publish(new EngineEvent.ProcessUpdated(now, process.snapshot()));
            }
        });
        LOG.info("Resumed chain execution {}", executionId);
        publishStatus(execution, now);
        processNextStep(execution);
        return true;
    }

    /**
     * Cancels an unfinished execution. The in-flight process is stopped and removed from its
     * converter; its consumed inputs are not refunded.
     *
     * @return false if the execution is unknown or already finished
     */
    public boolean cancel(ChainExecutionId executionId) {
        ChainExecution execution = executions.get(executionId);
        if (execution == null || execution.isFinished()) {
            return false;
        }
        long now = clock.millis();
        Optional<ChainStep> step = execution.currentStep().filter(s -> s.getStatus() == ProcessStatus.IN_PROGRESS);
        if (step.isPresent()) {
            ProcessId processId = step.get().getProcessId().orElseThrow();
            scheduler.findActive(processId).ifPresent(process -> process.abort(now));
            scheduler.dequeue(processId);
            step.get().fail(now);
            step.get().getConverterId().ifPresent(converterId -> launcher.release(converterId, processId));
        }
        LOG.info("Cancelled chain execution {}", executionId);
        terminate(execution, "Chain execution " + executionId + " cancelled");
        return true;
    }

    public Optional<ChainExecution> find(ChainExecutionId executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    public Optional<ChainExecutionStatus> status(ChainExecutionId executionId) {
        return find(executionId).map(this::snapshot);
    }

    public List<ChainExecutionStatus> statuses() {
        return executions.values().stream().map(this::snapshot).collect(Collectors.toList());
    }

    public long runningCount() {
        return executions.values().stream().filter(ChainExecution::isRunning).count();
    }

    public long getCompletedCount() {
        return completedCount;
    }

    public long getFailedCount() {
        return failedCount;
    }

    public void clear() {
        executions.clear();
        finishedOrder.clear();
    }

    private void complete(ChainExecution execution, List<ResourceAmount> finalOutputs, long now) {
        execution.markCompleted(now);
        completedCount++;
        LOG.info("Chain {} ({}) completed", execution.getChainId(), execution.getExecutionId());
        events.publish(new EngineEvent.ChainCompleted(now, execution.getChainId(), execution.getExecutionId(),
                finalOutputs));
        publishStatus(execution, now);
        retire(execution);
    }

    private void fail(ChainExecution execution, String message) {
        LOG.warn("Chain {} ({}) failed at step {}: {}", execution.getChainId(), execution.getExecutionId(),
                execution.getCurrentStepIndex(), message);
        errors.record("CHAIN_FAILED", message, String.format("Chain: %s, Execution: %s, Step: %d",
                execution.getChainId(), execution.getExecutionId(), execution.getCurrentStepIndex()));
        terminate(execution, message);
    }

    private void terminate(ChainExecution execution, String message) {
        long now = clock.millis();
        execution.markFailed(message, now);
        failedCount++;
        events.publish(new EngineEvent.ChainFailed(now, execution.getChainId(), execution.getExecutionId(),
                execution.getCurrentStepIndex(), message));
        publishStatus(execution, now);
        retire(execution);
    }

    private void retire(ChainExecution execution) {
        finishedOrder.addLast(execution.getExecutionId());
        while (finishedOrder.size() > maxChainHistory) {
            ChainExecutionId evicted = finishedOrder.pollFirst();
            executions.remove(evicted);
            LOG.debug("Evicted finished chain execution {} from history", evicted);
        }
    }

    void publishStatus(ChainExecution execution, long now) {
        events.publish(new EngineEvent.ChainStatusUpdated(now, snapshot(execution)));
    }

    private ChainExecutionStatus snapshot(ChainExecution execution) {
        return execution.snapshot(pid -> scheduler.find(pid).map(ConversionProcess::getProgress).orElse(0.0));
    }

    private List<ConverterNode> eligibleConverters(String recipeId) {
        return directory.getNodes().stream()
                .filter(node -> node.supports(recipeId))
                .collect(Collectors.toList());
    }

    private Optional<ConverterNode> selectConverter(List<ConverterNode> eligible, String preferredId) {
        if (preferredId != null) {
            for (ConverterNode node : eligible) {
                if (node.id().equals(preferredId) && node.hasSpareCapacity()) {
                    return Optional.of(node);
                }
            }
        }
        return eligible.stream().filter(ConverterNode::hasSpareCapacity).findFirst();
    }

    private Optional<ChainExecution> owningExecution(ConversionProcess process) {
        return process.getChainExecutionId().map(executions::get);
    }

    private Optional<ConversionProcess> inFlightProcess(ChainExecution execution) {
        return execution.currentStep()
                .filter(s -> s.getStatus() == ProcessStatus.IN_PROGRESS)
                .flatMap(ChainStep::getProcessId)
                .flatMap(scheduler::findActive);
    }

    /**
     * Publishes a status update for the chain owning {@code process}, if any.
     */
    public void publishStatusFor(ConversionProcess process) {
        owningExecution(process).ifPresent(execution -> publishStatus(execution, clock.millis()));
    }
}
