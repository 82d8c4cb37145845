package org.conflux.runtime.services;

import org.conflux.runtime.Config;
import org.conflux.runtime.api.ConversionError;
import org.conflux.runtime.api.ConversionErrorKind;
import org.conflux.runtime.api.NodeResult;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ConversionProcess;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.Recipe;
import org.conflux.runtime.model.ResourceAmount;
import org.conflux.runtime.spi.IEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Completion routine for processes that reached 100% progress.
 * <p>
 * Outputs are scaled by the process's applied efficiency and handed directly to the next chain
 * step's converter when one is known. If there is no such converter or the transfer fails, the
 * outputs go back into the source converter's pool. Afterwards the process is released from its
 * converter, the owning chain advances and chains waiting for capacity are poked again.
 */
public class ResourceTransferCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceTransferCoordinator.class);

    private final RecipeRegistry registry;
    private final DirectoryGateway directory;
    private final EfficiencyCalculator efficiencyCalculator;
    private final ProcessLauncher launcher;
    private final ChainExecutor chains;
    private final IEventSink events;
    private final OperationalErrorLog errors;
    private final Clock clock;

    public ResourceTransferCoordinator(RecipeRegistry registry, DirectoryGateway directory,
                                       EfficiencyCalculator efficiencyCalculator, ProcessLauncher launcher,
                                       ChainExecutor chains, IEventSink events, OperationalErrorLog errors, Clock clock) {
        this.registry = registry;
        this.directory = directory;
        this.efficiencyCalculator = efficiencyCalculator;
        this.launcher = launcher;
        this.chains = chains;
        this.events = events;
        this.errors = errors;
        this.clock = clock;
    }

    /**
     * Completes {@code process}: distributes its outputs, releases its converter slot and advances
     * its chain.
     */
    public void complete(ConversionProcess process) {
        long now = clock.millis();
        process.complete(now);
        String converterId = process.getSourceId();

        Optional<Recipe> recipe = registry.findRecipe(process.getRecipeId());
        if (recipe.isEmpty()) {
            abort(process, ConversionError.of(ConversionErrorKind.RECIPE_NOT_FOUND,
                    "Recipe %s not found", process.getRecipeId()));
            return;
        }

        OptionalDouble efficiency = resolveEfficiency(process, recipe.get());
        if (efficiency.isEmpty()) {
            abort(process, ConversionError.of(ConversionErrorKind.CONVERTER_NOT_FOUND_OR_INVALID,
                    "Converter node %s not found", converterId));
            return;
        }
        double applied = efficiency.getAsDouble();
        List<ResourceAmount> outputs = recipe.get().outputs().stream()
                .map(output -> output.scaled(applied))
                .collect(Collectors.toList());

        Optional<String> nextConverterId = chains.resolveNextConverter(process);
        boolean transferred = nextConverterId.isPresent() && transfer(process, converterId, nextConverterId.get(), outputs);
        if (!transferred) {
            addBack(process, converterId, outputs);
        }

        launcher.release(converterId, process.getProcessId());

        LOG.debug("Process {} ({}) completed on {} with efficiency {}", process.getProcessId(),
                process.getRecipeId(), converterId, String.format("%.2f", applied));
        events.publish(new EngineEvent.ConversionCompleted(now, process.getProcessId(), process.getRecipeId(),
                converterId, recipe.get().inputs(), outputs, applied));

        chains.onStepCompleted(process, outputs, applied);
        chains.repokeWaiting();
    }

    private OptionalDouble resolveEfficiency(ConversionProcess process, Recipe recipe) {
        OptionalDouble captured = process.getAppliedEfficiency();
        if (captured.isPresent()) {
            return OptionalDouble.of(Config.clampEfficiency(captured.getAsDouble()));
        }
        Optional<ConverterNode> converter = directory.getNode(process.getSourceId());
        if (converter.isEmpty()) {
            return OptionalDouble.empty();
        }
        double recomputed = efficiencyCalculator.calculateApplied(converter.get(), recipe);
        process.applyEfficiency(recomputed);
        return OptionalDouble.of(recomputed);
    }

    private boolean transfer(ConversionProcess process, String fromId, String toId, List<ResourceAmount> outputs) {
        NodeResult<Boolean> result = directory.transferResources(fromId, toId, outputs);
        if (result.isTrue()) {
            LOG.debug("Transferred outputs of {} from {} to {}", process.getProcessId(), fromId, toId);
            return true;
        }
        String reason = result.getError().map(ConversionError::message).orElse("transfer rejected");
        LOG.warn("Direct transfer of {} outputs from {} to {} failed, returning them to the source: {}",
                process.getProcessId(), fromId, toId, reason);
        errors.record(ConversionErrorKind.TRANSFER_FAILURE.name(), "Direct transfer failed",
                String.format("From: %s, To: %s, Process: %s, Reason: %s", fromId, toId, process.getProcessId(), reason));
        return false;
    }

    private void addBack(ConversionProcess process, String converterId, List<ResourceAmount> outputs) {
        NodeResult<Void> result = directory.addResources(converterId, outputs);
        result.getError().ifPresent(error -> {
            LOG.error("Outputs of process {} could not be added to {}: {}", process.getProcessId(), converterId,
                    error.message());
            errors.record(error.kind().name(), "Process outputs lost",
                    String.format("Converter: %s, Process: %s, Reason: %s", converterId, process.getProcessId(),
                            error.message()));
        });
    }

    private void abort(ConversionProcess process, ConversionError error) {
        LOG.error("Cannot complete process {}: {}. Outputs are lost", process.getProcessId(), error.message());
        errors.record(error.kind().name(), error.message(),
                String.format("Process: %s, Converter: %s", process.getProcessId(), process.getSourceId()));
        launcher.release(process.getSourceId(), process.getProcessId());
        chains.onStepFailed(process, error.message());
        chains.repokeWaiting();
    }
}
