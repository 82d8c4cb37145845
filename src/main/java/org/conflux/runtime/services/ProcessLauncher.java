package org.conflux.runtime.services;

import org.conflux.runtime.api.ConversionError;
import org.conflux.runtime.api.ConversionErrorKind;
import org.conflux.runtime.api.ConversionResult;
import org.conflux.runtime.api.NodeResult;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ChainExecutionId;
import org.conflux.runtime.model.ConversionProcess;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.ConverterNodeUpdate;
import org.conflux.runtime.model.ProcessId;
import org.conflux.runtime.model.Recipe;
import org.conflux.runtime.spi.IEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Starts conversion processes on converters.
 * <p>
 * A start resolves the recipe and converter, verifies and consumes the inputs, creates the
 * process with its efficiency captured, queues it on the {@link ProcessScheduler} and registers it
 * on the converter. Failures before the process exists are returned as a failed
 * {@link ConversionResult}; a failed converter registration afterwards is logged and recorded but
 * does not cancel the process.
 */
public class ProcessLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessLauncher.class);

    private final RecipeRegistry registry;
    private final DirectoryGateway directory;
    private final EfficiencyCalculator efficiencyCalculator;
    private final ProcessScheduler scheduler;
    private final IEventSink events;
    private final OperationalErrorLog errors;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong(0);

    public ProcessLauncher(RecipeRegistry registry, DirectoryGateway directory, EfficiencyCalculator efficiencyCalculator,
                           ProcessScheduler scheduler, IEventSink events, OperationalErrorLog errors, Clock clock) {
        this.registry = registry;
        this.directory = directory;
        this.efficiencyCalculator = efficiencyCalculator;
        this.scheduler = scheduler;
        this.events = events;
        this.errors = errors;
        this.clock = clock;
    }

    /**
     * Starts one process of {@code recipeId} on {@code converterId}.
     *
     * @param converterId      the converter to run on
     * @param recipeId         the recipe to run
     * @param chainExecutionId the owning chain execution, or null for an ad-hoc process
     * @return the outcome, carrying the new process id on success
     */
    public ConversionResult start(String converterId, String recipeId, ChainExecutionId chainExecutionId) {
        if (!directory.isBound()) {
            return fail(recipeId, ConversionError.of(ConversionErrorKind.DIRECTORY_UNAVAILABLE,
                    "Converter directory not set. Cannot start conversion process for recipe %s.", recipeId));
        }

        Optional<Recipe> recipe = registry.findRecipe(recipeId);
        if (recipe.isEmpty()) {
            return fail(recipeId, ConversionError.of(ConversionErrorKind.RECIPE_NOT_FOUND,
                    "Recipe %s not found.", recipeId));
        }

        Optional<ConverterNode> converter = directory.getNode(converterId);
        if (converter.isEmpty() || !converter.get().supports(recipeId)) {
            return fail(recipeId, ConversionError.of(ConversionErrorKind.CONVERTER_NOT_FOUND_OR_INVALID,
                    "Converter node %s not found or invalid for recipe %s.", converterId, recipeId));
        }
        if (!converter.get().hasSpareCapacity()) {
            return fail(recipeId, ConversionError.of(ConversionErrorKind.CONVERTER_AT_CAPACITY,
                    "Converter node %s has no spare capacity (%d/%d).", converterId,
                    converter.get().activeProcessIds().size(), converter.get().configuration().maxConcurrentProcesses()));
        }

        NodeResult<Boolean> available = directory.checkResourcesAvailable(converterId, recipe.get().inputs());
        if (available.getError().isPresent()) {
            return fail(recipeId, available.getError().get());
        }
        if (!available.isTrue()) {
            return fail(recipeId, ConversionError.of(ConversionErrorKind.INSUFFICIENT_RESOURCES,
                    "Insufficient resources on %s for recipe %s.", converterId, recipeId));
        }

        NodeResult<Boolean> consumed = directory.consumeResources(converterId, recipe.get().inputs());
        if (consumed.getError().isPresent()) {
            return fail(recipeId, consumed.getError().get());
        }
        if (!consumed.isTrue()) {
            return fail(recipeId, ConversionError.of(ConversionErrorKind.CONSUME_FAILURE,
                    "Failed to consume resources on %s for recipe %s (potentially unavailable now).", converterId, recipeId));
        }

        long now = clock.millis();
        ProcessId processId = new ProcessId("proc-" + sequence.incrementAndGet());
        ConversionProcess process = new ConversionProcess(processId, recipeId, converterId, now, chainExecutionId);

        // Efficiency is captured against the node state before this process occupies a slot.
        process.applyEfficiency(efficiencyCalculator.calculateApplied(converter.get(), recipe.get()));
        LOG.debug("Applied efficiency {} to process {} on converter {}",
                String.format("%.2f", process.getAppliedEfficiency().orElse(0.0)), processId, converterId);

        scheduler.enqueue(process);
        registerOnConverter(converterId, processId);

        events.publish(new EngineEvent.ProcessStarted(now, process.snapshot()));
        return ConversionResult.started(processId, recipeId);
    }

    private void registerOnConverter(String converterId, ProcessId processId) {
        Optional<ConverterNode> current = directory.getNode(converterId);
        if (current.isEmpty()) {
            LOG.warn("Converter node {} disappeared before process {} could be registered on it", converterId, processId);
            errors.record(ConversionErrorKind.NODE_UPDATE_FAILURE.name(), "Converter node vanished after process start",
                    String.format("Converter: %s, Process: %s", converterId, processId));
            return;
        }
        List<String> activeIds = new ArrayList<>(current.get().activeProcessIds());
        activeIds.add(processId.value());
        NodeResult<Void> update = directory.updateNodeData(converterId, ConverterNodeUpdate.activeProcessIds(activeIds));
        update.getError().ifPresent(error -> {
            LOG.warn("Error updating node {} after starting process {}: {}", converterId, processId, error.message());
            errors.record(error.kind().name(), "Node update failed after process start",
                    String.format("Converter: %s, Process: %s, Reason: %s", converterId, processId, error.message()));
        });
    }

    /**
     * Removes a finished or cancelled process from its converter's active list. Failures are
     * logged and recorded; the process stays finished either way.
     *
     * @return true if the converter no longer lists the process
     */
    public boolean release(String converterId, ProcessId processId) {
        Optional<ConverterNode> current = directory.getNode(converterId);
        if (current.isEmpty()) {
            LOG.warn("Converter node {} not found while releasing process {}", converterId, processId);
            errors.record(ConversionErrorKind.NODE_UPDATE_FAILURE.name(), "Converter node not found on release",
                    String.format("Converter: %s, Process: %s", converterId, processId));
            return false;
        }
        List<String> activeIds = new ArrayList<>(current.get().activeProcessIds());
        if (!activeIds.remove(processId.value())) {
            return true;
        }
        NodeResult<Void> update = directory.updateNodeData(converterId, ConverterNodeUpdate.activeProcessIds(activeIds));
        if (update.getError().isPresent()) {
            ConversionError error = update.getError().get();
            LOG.warn("Error updating node {} after process {} finished: {}", converterId, processId, error.message());
            errors.record(error.kind().name(), "Node update failed after process completion",
                    String.format("Converter: %s, Process: %s, Reason: %s", converterId, processId, error.message()));
            return false;
        }
        return true;
    }

    private ConversionResult fail(String recipeId, ConversionError error) {
        LOG.warn("Cannot start conversion process for recipe {}: {}", recipeId, error.message());
        return ConversionResult.failed(recipeId, error);
    }
}
