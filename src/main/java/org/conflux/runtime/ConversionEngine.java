package org.conflux.runtime;

import org.conflux.runtime.api.ConversionResult;
import org.conflux.runtime.api.IMonitorable;
import org.conflux.runtime.api.OperationalError;
import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ChainExecutionId;
import org.conflux.runtime.model.ChainExecutionStatus;
import org.conflux.runtime.model.ConversionChain;
import org.conflux.runtime.model.ConversionProcess;
import org.conflux.runtime.model.ProcessId;
import org.conflux.runtime.model.ProcessSnapshot;
import org.conflux.runtime.model.Recipe;
import org.conflux.runtime.services.ChainExecutor;
import org.conflux.runtime.services.DirectoryGateway;
import org.conflux.runtime.services.EfficiencyCalculator;
import org.conflux.runtime.services.OperationalErrorLog;
import org.conflux.runtime.services.ProcessLauncher;
import org.conflux.runtime.services.ProcessScheduler;
import org.conflux.runtime.services.RecipeRegistry;
import org.conflux.runtime.services.ResourceTransferCoordinator;
import org.conflux.runtime.spi.IConverterDirectory;
import org.conflux.runtime.spi.IEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resource conversion and flow engine.
 * <p>
 * Runs recipes on capacity-bounded converter nodes, advances them on a fixed-interval tick and
 * routes their outputs, either back into the converter's pool or directly to the converter of the
 * next chain step. Converter state lives in an injected {@link IConverterDirectory}; notifications
 * go to an injected {@link IEventSink}.
 * <p>
 * <strong>Lifecycle:</strong> {@link #initialize()} starts the tick timer, {@link #dispose()}
 * stops it and drops all recipes, chains, processes and chain executions. {@link #tick()} may also
 * be called directly, which together with a {@link SimulatedClock} makes the engine deterministic.
 * <p>
 * <strong>Thread Safety:</strong> every public method synchronizes on the engine, so the timer
 * thread and API callers never interleave. Returned objects are snapshots.
 */
public class ConversionEngine implements IMonitorable {

    private static final Logger LOG = LoggerFactory.getLogger(ConversionEngine.class);

    private final EngineOptions options;
    private final Clock clock;
    private final IEventSink events;

    private final RecipeRegistry registry = new RecipeRegistry();
    private final DirectoryGateway directory = new DirectoryGateway();
    private final EfficiencyCalculator efficiencyCalculator = new EfficiencyCalculator();
    private final OperationalErrorLog errors;
    private final ProcessScheduler scheduler;
    private final ProcessLauncher launcher;
    private final ChainExecutor chains;
    private final ResourceTransferCoordinator coordinator;

    public ConversionEngine(EngineOptions options, Clock clock, IEventSink events) {
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = Objects.requireNonNull(events, "events");
        this.errors = new OperationalErrorLog(options.maxErrors(), clock);
        this.scheduler = new ProcessScheduler(options.maxProcessHistory());
        this.launcher = new ProcessLauncher(registry, directory, efficiencyCalculator, scheduler, events, errors, clock);
        this.chains = new ChainExecutor(registry, directory, launcher, scheduler, events, errors, clock,
                options.maxChainHistory());
        this.coordinator = new ResourceTransferCoordinator(registry, directory, efficiencyCalculator, launcher,
                chains, events, errors, clock);
    }

    public ConversionEngine(IEventSink events) {
        this(EngineOptions.defaults(), Clock.systemUTC(), events);
    }

    /**
     * Injects the converter node directory. Replaces any previously set directory.
     */
    public synchronized void setConverterDirectory(IConverterDirectory converterDirectory) {
        directory.bind(converterDirectory);
        LOG.debug("Converter directory set to {}", converterDirectory == null ? "none" : converterDirectory.getClass().getSimpleName());
    }

    /**
     * Alias of {@link #setConverterDirectory(IConverterDirectory)} named after the resource flow
     * manager that usually provides the directory.
     */
    public void setResourceFlowManager(IConverterDirectory converterDirectory) {
        setConverterDirectory(converterDirectory);
    }

    /**
     * Starts the tick timer.
     *
     * @throws IllegalStateException if the engine is already initialized
     */
    public void initialize() {
        scheduler.start(options.tickIntervalMs(), this::tick);
        LOG.info("Conversion engine initialized");
    }

    public boolean isInitialized() {
        return scheduler.isRunning();
    }

    /**
     * Stops the tick timer and drops all state. In-flight processes are discarded without being
     * completed or released from their converters.
     */
    public void dispose() {
        // Stopped outside the engine lock: a tick waiting for the lock must not block the shutdown.
        scheduler.stop();
        synchronized (this) {
            scheduler.clear();
            chains.clear();
            registry.clear();
            errors.clear();
        }
        LOG.info("Conversion engine disposed");
    }

    /**
     * Registers or replaces a recipe. Running processes keep the efficiency they captured at start.
     *
     * @return false if the recipe has no id
     */
    public synchronized boolean registerConversionRecipe(Recipe recipe) {
        return registry.registerRecipe(recipe);
    }

    /**
     * Registers or replaces a chain. Its recipe ids are not validated until a step reaches them.
     *
     * @return false if the chain has no id
     */
    public synchronized boolean registerConversionChain(ConversionChain chain) {
        return registry.registerChain(chain);
    }

    /**
     * Starts a new execution of a registered chain.
     *
     * @return true if the chain exists; the execution may still fail immediately
     */
    public synchronized boolean startConversionChain(String chainId) {
        return chains.start(chainId).isPresent();
    }

    /**
     * Starts a new execution of a registered chain and returns its id.
     */
    public synchronized Optional<ChainExecutionId> startChainExecution(String chainId) {
        return chains.start(chainId);
    }

    /**
     * Starts a process outside any chain.
     */
    public synchronized ConversionResult startConversionProcess(String converterId, String recipeId) {
        return launcher.start(converterId, recipeId, null);
    }

    /**
     * Runs one scheduler sweep at the clock's current time.
     *
     * @return the number of processes completed
     */
    public synchronized int tick() {
        int completed = scheduler.sweep(clock.millis(), registry::findRecipe, coordinator::complete);
        if (completed > 0) {
            LOG.debug("Tick {} completed {} process(es), {} still queued", scheduler.getTickCount(), completed,
                    scheduler.queueSize());
        }
        return completed;
    }

    public synchronized boolean pauseProcess(ProcessId processId) {
        return updateProcess(processId, true);
    }

    public synchronized boolean resumeProcess(ProcessId processId) {
        return updateProcess(processId, false);
    }

    private boolean updateProcess(ProcessId processId, boolean pause) {
        Optional<ConversionProcess> process = scheduler.findActive(processId);
        if (process.isEmpty()) {
            return false;
        }
        long now = clock.millis();
        boolean changed = pause ? process.get().pause(now) : process.get().resume(now);
        if (!changed) {
            return false;
        }
        events.publish(new EngineEvent.ProcessUpdated(now, process.get().snapshot()));
        chains.publishStatusFor(process.get());
        return true;
    }

    public synchronized boolean pauseChain(ChainExecutionId executionId) {
        return chains.pause(executionId);
    }

    public synchronized boolean resumeChain(ChainExecutionId executionId) {
        return chains.resume(executionId);
    }

    public synchronized boolean cancelChain(ChainExecutionId executionId) {
        return chains.cancel(executionId);
    }

    /**
     * Pokes a running chain whose current step is waiting for a free converter.
     */
    public synchronized boolean retryChain(ChainExecutionId executionId) {
        return chains.retry(executionId);
    }

    public synchronized Optional<Recipe> getRecipe(String recipeId) {
        return registry.findRecipe(recipeId);
    }

    public synchronized Optional<ConversionChain> getChain(String chainId) {
        return registry.findChain(chainId);
    }

    public synchronized Optional<ChainExecutionStatus> getChainStatus(ChainExecutionId executionId) {
        return chains.status(executionId);
    }

    public synchronized List<ChainExecutionStatus> getChainExecutions() {
        return chains.statuses();
    }

    public synchronized List<ProcessSnapshot> getActiveProcesses() {
        return scheduler.getQueue().stream().map(ConversionProcess::snapshot).collect(Collectors.toList());
    }

    public synchronized Optional<ProcessSnapshot> getProcess(ProcessId processId) {
        return scheduler.find(processId).map(ConversionProcess::snapshot);
    }

    public synchronized List<ProcessSnapshot> getCompletedProcesses() {
        return scheduler.getCompletedHistory().stream().map(ConversionProcess::snapshot).collect(Collectors.toList());
    }

    @Override
    public synchronized Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("ticks", scheduler.getTickCount());
        metrics.put("active_processes", scheduler.queueSize());
        metrics.put("completed_processes", scheduler.historySize());
        metrics.put("active_chains", chains.runningCount());
        metrics.put("completed_chains", chains.getCompletedCount());
        metrics.put("failed_chains", chains.getFailedCount());
        metrics.put("error_count", errors.size());
        return metrics;
    }

    @Override
    public synchronized List<OperationalError> getErrors() {
        return errors.snapshot();
    }

    @Override
    public synchronized void clearErrors() {
        errors.clear();
    }

    /**
     * Healthy while a directory is bound and no operational error has been recorded since the last
     * {@link #clearErrors()}.
     */
    @Override
    public synchronized boolean isHealthy() {
        return directory.isBound() && errors.isEmpty();
    }
}
