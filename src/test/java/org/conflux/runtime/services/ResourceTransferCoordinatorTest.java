package org.conflux.runtime.services;

import org.conflux.junit.logging.ExpectLog;
import org.conflux.junit.logging.LogLevel;
import org.conflux.junit.logging.LogWatchExtension;
import org.conflux.runtime.RecordingEventSink;
import org.conflux.runtime.SimulatedClock;
import org.conflux.runtime.api.ConversionErrorKind;
import org.conflux.runtime.api.OperationalError;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ConversionProcess;
import org.conflux.runtime.model.ConverterNodeUpdate;
import org.conflux.runtime.model.ProcessId;
import org.conflux.runtime.model.ResourceAmount;
import org.conflux.topology.InMemoryConverterDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.conflux.runtime.TestEconomy.converter;
import static org.conflux.runtime.TestEconomy.recipe;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ResourceTransferCoordinatorTest {

    private final SimulatedClock clock = new SimulatedClock(0);
    private final RecordingEventSink events = new RecordingEventSink();
    private final RecipeRegistry registry = new RecipeRegistry();
    private final DirectoryGateway gateway = new DirectoryGateway();
    private final OperationalErrorLog errors = new OperationalErrorLog(10, clock);
    private final InMemoryConverterDirectory directory = new InMemoryConverterDirectory();

    private ProcessScheduler scheduler;
    private ProcessLauncher launcher;
    private ResourceTransferCoordinator coordinator;

    @BeforeEach
    void setUp() {
        EfficiencyCalculator calculator = new EfficiencyCalculator();
        scheduler = new ProcessScheduler(10);
        launcher = new ProcessLauncher(registry, gateway, calculator, scheduler, events, errors, clock);
        ChainExecutor chains = new ChainExecutor(registry, gateway, launcher, scheduler, events, errors, clock, 10);
        coordinator = new ResourceTransferCoordinator(registry, gateway, calculator, launcher, chains, events,
                errors, clock);
        gateway.bind(directory);
        directory.register(converter("C1", 1, Set.of("R1"), Map.of("A", 10)));
        registry.registerRecipe(recipe("R1", "A", 10, "B", 4, 100));
    }

    private ConversionProcess startProcess() {
        assertThat(launcher.start("C1", "R1", null).success()).isTrue();
        return scheduler.findActive(new ProcessId("proc-1")).orElseThrow();
    }

    @Test
    void complete_shouldReturnOutputsToSourceAndReleaseSlot() {
        ConversionProcess process = startProcess();
        clock.advanceMillis(100);

        coordinator.complete(process);

        assertThat(directory.resourcesOf("C1")).containsEntry("B", 4);
        assertThat(directory.getNode("C1").orElseThrow().activeProcessIds()).isEmpty();
        assertThat(process.isActive()).isFalse();
        assertThat(process.getEndTime()).hasValue(100L);
        assertThat(events.ofType(EngineEvent.ConversionCompleted.class)).singleElement()
                .satisfies(e -> assertThat(e.outputs()).containsExactly(new ResourceAmount("B", 4)));
        assertThat(errors.isEmpty()).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Cannot complete process proc-1: Recipe R1 not found\\. Outputs are lost")
    void complete_shouldDropOutputsWhenRecipeIsGone() {
        ConversionProcess process = startProcess();
        registry.clear();

        coordinator.complete(process);

        assertThat(directory.resourcesOf("C1")).doesNotContainKey("B");
        assertThat(directory.getNode("C1").orElseThrow().activeProcessIds()).isEmpty();
        assertThat(errors.snapshot()).extracting(OperationalError::errorType)
                .containsExactly(ConversionErrorKind.RECIPE_NOT_FOUND.name());
        assertThat(events.ofType(EngineEvent.ConversionCompleted.class)).isEmpty();
    }

    @Test
    void complete_shouldKeepCapturedEfficiencyWhenConverterChanges() {
        ConversionProcess process = startProcess();
        directory.updateNodeData("C1", ConverterNodeUpdate.efficiency(0.1));

        coordinator.complete(process);

        assertThat(directory.resourcesOf("C1")).containsEntry("B", 4);
        assertThat(process.getAppliedEfficiency()).hasValue(1.0);
    }
}
