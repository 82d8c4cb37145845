package org.conflux.runtime.events;

/**
 * Names of the notifications published by the engine.
 */
public enum EventType {
    CHAIN_STEP_STARTED,
    CHAIN_STEP_COMPLETED,
    CHAIN_COMPLETED,
    CHAIN_FAILED,
    RESOURCE_UPDATED,
    CHAIN_STATUS_UPDATED
}
