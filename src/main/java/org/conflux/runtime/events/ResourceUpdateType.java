package org.conflux.runtime.events;

/**
 * Sub-type of a {@link EventType#RESOURCE_UPDATED} notification.
 */
public enum ResourceUpdateType {
    RESOURCE_CONVERSION_COMPLETED,
    PROCESS_STARTED,
    PROCESS_UPDATED
}
