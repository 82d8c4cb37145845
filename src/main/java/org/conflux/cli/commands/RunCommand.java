package org.conflux.cli.commands;

import org.conflux.cli.CommandLineInterface;
import org.conflux.cli.rendering.IRunRenderer;
import org.conflux.cli.rendering.JsonRunRenderer;
import org.conflux.cli.rendering.TextRunRenderer;
import org.conflux.runtime.ConversionEngine;
import org.conflux.runtime.EngineOptions;
import org.conflux.runtime.SimulatedClock;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.events.EventBus;
import org.conflux.runtime.events.LoggingEventSink;
import org.conflux.runtime.model.ChainExecutionId;
import org.conflux.runtime.model.ChainExecutionStatus;
import org.conflux.runtime.model.ConversionChain;
import org.conflux.scenario.Scenario;
import org.conflux.scenario.ScenarioException;
import org.conflux.scenario.ScenarioLoader;
import org.conflux.topology.InMemoryConverterDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Command(
    name = "run",
    description = "Runs the chains of a scenario and reports their outcome. "
            + "Exits with 0 if every started chain completed, 2 otherwise."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    /** Exit code when at least one chain failed or did not finish in time. */
    public static final int EXIT_CHAINS_UNFINISHED = 2;

    public enum Format { TEXT, JSON }

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "SCENARIO", description = "Scenario file (HOCON)")
    private File scenarioFile;

    @Option(names = "--chain", paramLabel = "ID", description = "Chain to start; repeatable (default: every chain)")
    private List<String> chainIds = new ArrayList<>();

    @Option(names = "--ticks", paramLabel = "N", defaultValue = "1000", description = "Maximum number of ticks (default: ${DEFAULT-VALUE})")
    private int maxTicks;

    @Option(names = "--format", paramLabel = "FORMAT", defaultValue = "TEXT", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format;

    @Option(names = "--realtime", description = "Drive the engine with its timer and the system clock instead of simulated time")
    private boolean realtime;

    @Override
    public Integer call() throws Exception {
        final EngineOptions options = EngineOptions.fromConfig(parent.getConfig());
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Scenario scenario;
        try {
            scenario = ScenarioLoader.load(scenarioFile);
        } catch (ScenarioException e) {
            err.println(e.getMessage());
            return 1;
        }
        final List<String> selected = chainIds.isEmpty()
                ? scenario.chains().stream().map(ConversionChain::id).collect(Collectors.toList())
                : chainIds;
        for (String chainId : selected) {
            if (scenario.findChain(chainId).isEmpty()) {
                err.println("Unknown chain: " + chainId);
                return 1;
            }
        }

        final Clock clock = realtime ? Clock.systemUTC() : new SimulatedClock(0L);
        final IRunRenderer renderer = format == Format.JSON
                ? new JsonRunRenderer(out)
                : new TextRunRenderer(out, clock.millis());

        final Map<ChainExecutionId, ChainExecutionStatus> latest = new ConcurrentHashMap<>();
        final EventBus bus = new EventBus();
        bus.subscribe(EngineEvent.class, renderer::event);
        bus.subscribe(EngineEvent.ChainStatusUpdated.class,
                e -> latest.put(e.chainStatus().executionId(), e.chainStatus()));

        final InMemoryConverterDirectory directory = new InMemoryConverterDirectory();
        scenario.converters().forEach(directory::register);

        final ConversionEngine engine = new ConversionEngine(options, clock, new LoggingEventSink(bus));
        engine.setConverterDirectory(directory);
        scenario.recipes().forEach(engine::registerConversionRecipe);
        scenario.chains().forEach(engine::registerConversionChain);

        LOGGER.info("Running scenario '{}' with {} chain(s), {} tick(s) at most", scenario.name(), selected.size(), maxTicks);
        final List<ChainExecutionId> started = new ArrayList<>();
        for (String chainId : selected) {
            engine.startChainExecution(chainId).ifPresent(started::add);
        }

        try {
            if (realtime) {
                runRealtime(engine, options, started, latest);
            } else {
                runSimulated(engine, options, (SimulatedClock) clock, started, latest);
            }
            final List<ChainExecutionStatus> finalStatus = new ArrayList<>();
            for (ChainExecutionId id : started) {
                statusOf(engine, id, latest).ifPresent(finalStatus::add);
            }
            renderer.summary(finalStatus, directory.getNodes(), engine.getMetrics());
            final boolean allCompleted = finalStatus.size() == started.size()
                    && finalStatus.stream().allMatch(ChainExecutionStatus::completed);
            return allCompleted ? 0 : EXIT_CHAINS_UNFINISHED;
        } finally {
            engine.dispose();
        }
    }

    private void runSimulated(ConversionEngine engine, EngineOptions options, SimulatedClock clock,
                              List<ChainExecutionId> started, Map<ChainExecutionId, ChainExecutionStatus> latest) {
        int ticks = 0;
        while (ticks < maxTicks && !allFinished(engine, started, latest)) {
            clock.advanceMillis(options.tickIntervalMs());
            engine.tick();
            ticks++;
        }
        LOGGER.debug("Simulated run stopped after {} tick(s)", ticks);
    }

    private void runRealtime(ConversionEngine engine, EngineOptions options, List<ChainExecutionId> started,
                             Map<ChainExecutionId, ChainExecutionStatus> latest) throws InterruptedException {
        engine.initialize();
        final long deadline = System.currentTimeMillis() + maxTicks * options.tickIntervalMs();
        while (System.currentTimeMillis() < deadline && !allFinished(engine, started, latest)) {
            Thread.sleep(Math.min(options.tickIntervalMs(), 100L));
        }
    }

    private static boolean allFinished(ConversionEngine engine, List<ChainExecutionId> started,
                                       Map<ChainExecutionId, ChainExecutionStatus> latest) {
        for (ChainExecutionId id : started) {
            Optional<ChainExecutionStatus> status = statusOf(engine, id, latest);
            if (status.isPresent() && !status.get().isFinished()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Live status if the engine still holds the execution, otherwise the last published one.
     */
    private static Optional<ChainExecutionStatus> statusOf(ConversionEngine engine, ChainExecutionId id,
                                                           Map<ChainExecutionId, ChainExecutionStatus> latest) {
        Optional<ChainExecutionStatus> live = engine.getChainStatus(id);
        return live.isPresent() ? live : Optional.ofNullable(latest.get(id));
    }
}
