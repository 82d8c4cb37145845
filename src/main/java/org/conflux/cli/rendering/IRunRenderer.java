package org.conflux.cli.rendering;

import org.conflux.runtime.events.EngineEvent;
import org.conflux.runtime.model.ChainExecutionStatus;
import org.conflux.runtime.model.ConverterNode;

import java.util.List;
import java.util.Map;

/**
 * Writes the output of a scenario run.
 */
public interface IRunRenderer {

    /**
     * Renders one engine event as it happens.
     */
    void event(EngineEvent event);

    /**
     * Renders the final state after the run.
     *
     * @param chains     final status of every started chain execution
     * @param converters converter nodes with their final resource pools
     * @param metrics    engine metrics
     */
    void summary(List<ChainExecutionStatus> chains, List<ConverterNode> converters, Map<String, Number> metrics);
}
