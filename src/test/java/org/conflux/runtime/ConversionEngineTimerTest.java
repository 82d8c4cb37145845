package org.conflux.runtime;

import org.conflux.junit.logging.LogWatchExtension;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ChainExecutionId;
import org.conflux.runtime.model.ConversionChain;
import org.conflux.topology.InMemoryConverterDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.conflux.runtime.TestEconomy.converter;
import static org.conflux.runtime.TestEconomy.recipe;

/**
 * Runs a two-step chain on the real tick timer and wall clock.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class ConversionEngineTimerTest {

    private final RecordingEventSink events = new RecordingEventSink();
    private final ConversionEngine engine =
            new ConversionEngine(EngineOptions.defaults().withTickInterval(10), Clock.systemUTC(), events);

    @AfterEach
    void tearDown() {
        engine.dispose();
    }

    @Test
    void timer_shouldDriveChainToCompletion() {
        InMemoryConverterDirectory directory = new InMemoryConverterDirectory();
        directory.register(converter("C1", 1, Set.of("R1"), Map.of("A", 10)));
        directory.register(converter("C2", 1, Set.of("R2"), Map.of()));
        engine.setConverterDirectory(directory);
        engine.registerConversionRecipe(recipe("R1", "A", 10, "B", 5, 50));
        engine.registerConversionRecipe(recipe("R2", "B", 5, "C", 1, 50));
        engine.registerConversionChain(new ConversionChain("chain", List.of("R1", "R2")));

        engine.initialize();
        ChainExecutionId executionId = engine.startChainExecution("chain").orElseThrow();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> engine.getChainStatus(executionId).map(s -> s.completed()).orElse(false));

        assertThat(events.ofType(EngineEvent.ChainCompleted.class)).singleElement()
                .satisfies(e -> assertThat(e.finalOutputs()).containsExactly(TestEconomy.amount("C", 1)));
        assertThat(directory.resourcesOf("C2")).containsEntry("C", 1);
        assertThat((Long) engine.getMetrics().get("ticks")).isPositive();
        assertThat(engine.isHealthy()).isTrue();
    }
}
