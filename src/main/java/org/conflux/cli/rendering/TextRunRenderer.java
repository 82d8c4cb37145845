package org.conflux.cli.rendering;

import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ChainExecutionStatus;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.ResourceAmount;

import java.io.PrintWriter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Human-readable run output. Status snapshots and process bookkeeping events are left out of the
 * event log; the summary shows the final chain states and resource pools.
 */
public class TextRunRenderer implements IRunRenderer {

    private final PrintWriter out;
    private final long startMillis;

    /**
     * @param out         destination
     * @param startMillis run start, event times are printed relative to it
     */
    public TextRunRenderer(PrintWriter out, long startMillis) {
        this.out = out;
        this.startMillis = startMillis;
    }

    @Override
    public synchronized void event(EngineEvent event) {
        String line = describe(event);
        if (line != null) {
            out.printf("[%8d ms] %s%n", event.timestamp() - startMillis, line);
            out.flush();
        }
    }

    private static String describe(EngineEvent event) {
        if (event instanceof EngineEvent.ChainStepStarted e) {
            return String.format("%s step %d (%s) started on %s as %s",
                    e.executionId(), e.stepIndex(), e.recipeId(), e.converterId(), e.processId());
        }
        if (event instanceof EngineEvent.ChainStepCompleted e) {
            return String.format("%s step %d (%s) completed on %s: %s at %.0f%%",
                    e.executionId(), e.stepIndex(), e.recipeId(), e.converterId(), amounts(e.outputs()),
                    e.efficiency() * 100);
        }
        if (event instanceof EngineEvent.ChainCompleted e) {
            return String.format("%s completed: %s", e.executionId(), amounts(e.finalOutputs()));
        }
        if (event instanceof EngineEvent.ChainFailed e) {
            return String.format("%s failed at step %d: %s", e.executionId(), e.stepIndex(), e.errorMessage());
        }
        if (event instanceof EngineEvent.ConversionCompleted e) {
            return String.format("%s (%s) on %s produced %s", e.processId(), e.recipeId(), e.converterId(),
                    amounts(e.outputs()));
        }
        return null;
    }

    @Override
    public synchronized void summary(List<ChainExecutionStatus> chains, List<ConverterNode> converters,
                                     Map<String, Number> metrics) {
        out.println();
        out.println("Chains:");
        for (ChainExecutionStatus chain : chains) {
            String state = chain.completed() ? "COMPLETED" : chain.failed() ? "FAILED" : chain.paused() ? "PAUSED" : "RUNNING";
            out.printf("  %-32s %-9s %5.1f%%%s%n", chain.executionId(), state, chain.progress() * 100,
                    chain.errorMessage() == null ? "" : "  " + chain.errorMessage());
        }
        out.println("Converters:");
        converters.stream()
                .sorted(Comparator.comparing(ConverterNode::id))
                .forEach(node -> out.printf("  %-20s %s%n", node.id(), new TreeMap<>(node.resources())));
        out.println("Metrics: " + metrics);
        out.flush();
    }

    private static String amounts(List<ResourceAmount> amounts) {
        if (amounts.isEmpty()) {
            return "nothing";
        }
        return amounts.stream().map(a -> a.amount() + " " + a.type()).collect(Collectors.joining(", "));
    }
}
