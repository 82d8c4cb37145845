package org.conflux.runtime.events;

import org.conflux.runtime.model.ChainExecutionId;
import org.conflux.runtime.model.ChainExecutionStatus;
import org.conflux.runtime.model.ProcessId;
import org.conflux.runtime.model.ProcessSnapshot;
import org.conflux.runtime.model.ResourceAmount;

import java.util.List;

/**
 * Closed set of notifications emitted by the conversion engine. Each variant carries its own
 * strongly-typed payload and the time it was emitted (epoch milliseconds).
 */
public sealed interface EngineEvent permits EngineEvent.ChainStepStarted, EngineEvent.ChainStepCompleted,
        EngineEvent.ChainCompleted, EngineEvent.ChainFailed, EngineEvent.ResourceUpdated,
        EngineEvent.ChainStatusUpdated {

    EventType type();

    long timestamp();

    /**
     * A chain step obtained a converter and its process started.
     */
    record ChainStepStarted(long timestamp, String chainId, ChainExecutionId executionId, int stepIndex,
                            String recipeId, ProcessId processId, String converterId) implements EngineEvent {
        @Override
        public EventType type() {
            return EventType.CHAIN_STEP_STARTED;
        }
    }

    /**
     * A chain step's process completed and its outputs were distributed.
     */
    record ChainStepCompleted(long timestamp, String chainId, ChainExecutionId executionId, int stepIndex,
                              ProcessId processId, String recipeId, String converterId,
                              List<ResourceAmount> outputs, double efficiency) implements EngineEvent {
        public ChainStepCompleted {
            outputs = List.copyOf(outputs);
        }

        @Override
        public EventType type() {
            return EventType.CHAIN_STEP_COMPLETED;
        }
    }

    /**
     * Every step of a chain completed.
     */
    record ChainCompleted(long timestamp, String chainId, ChainExecutionId executionId,
                          List<ResourceAmount> finalOutputs) implements EngineEvent {
        public ChainCompleted {
            finalOutputs = List.copyOf(finalOutputs);
        }

        @Override
        public EventType type() {
            return EventType.CHAIN_COMPLETED;
        }
    }

    /**
     * A chain entered the failed state, either on error or by cancellation.
     */
    record ChainFailed(long timestamp, String chainId, ChainExecutionId executionId, int stepIndex,
                       String errorMessage) implements EngineEvent {
        @Override
        public EventType type() {
            return EventType.CHAIN_FAILED;
        }
    }

    /**
     * Chain status changed; carries a full snapshot.
     */
    record ChainStatusUpdated(long timestamp, ChainExecutionStatus chainStatus) implements EngineEvent {
        @Override
        public EventType type() {
            return EventType.CHAIN_STATUS_UPDATED;
        }
    }

    /**
     * Resource-related notifications, distinguished by {@link ResourceUpdateType}.
     */
    sealed interface ResourceUpdated extends EngineEvent
            permits ConversionCompleted, ProcessStarted, ProcessUpdated {

        ResourceUpdateType updateType();

        @Override
        default EventType type() {
            return EventType.RESOURCE_UPDATED;
        }
    }

    /**
     * A process completed; outputs are already scaled by efficiency.
     */
    record ConversionCompleted(long timestamp, ProcessId processId, String recipeId, String converterId,
                               List<ResourceAmount> inputs, List<ResourceAmount> outputs,
                               double efficiency) implements ResourceUpdated {
        public ConversionCompleted {
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
        }

        @Override
        public ResourceUpdateType updateType() {
            return ResourceUpdateType.RESOURCE_CONVERSION_COMPLETED;
        }
    }

    /**
     * A process started on a converter.
     */
    record ProcessStarted(long timestamp, ProcessSnapshot process) implements ResourceUpdated {
        @Override
        public ResourceUpdateType updateType() {
            return ResourceUpdateType.PROCESS_STARTED;
        }
    }

    /**
     * A process was paused or resumed.
     */
    record ProcessUpdated(long timestamp, ProcessSnapshot process) implements ResourceUpdated {
        @Override
        public ResourceUpdateType updateType() {
            return ResourceUpdateType.PROCESS_UPDATED;
        }
    }
}
