package org.conflux.runtime.api;

import java.time.Instant;

/**
 * Represents a transient operational error that occurred inside the engine.
 * <p>
 * This record is used to provide structured information about errors that did not stop the
 * engine but may have left node bookkeeping or resource pools inconsistent.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "NODE_UPDATE_FAILURE", "TRANSFER_FAILURE").
 * @param message   A human-readable description of the error.
 * @param details   Additional context, such as the affected process and converter.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
