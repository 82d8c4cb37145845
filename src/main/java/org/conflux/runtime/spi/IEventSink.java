package org.conflux.runtime.spi;

import org.conflux.runtime.events.EngineEvent;

/**
 * Receives the engine's notifications. Publishing is fire-and-forget: implementations must not
 * throw back into the engine.
 */
@FunctionalInterface
public interface IEventSink {

    /**
     * Publishes one event.
     *
     * @param event the event, never null
     */
    void publish(EngineEvent event);

    /**
     * A sink that discards every event.
     */
    static IEventSink discarding() {
        return event -> { };
    }
}
