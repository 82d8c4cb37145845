package org.conflux.runtime.api;

import org.conflux.runtime.model.ProcessId;

import java.util.Optional;

/**
 * Result of starting a conversion process. Failures are reported here instead of being thrown.
 *
 * @param success   Whether the process was started.
 * @param processId The new process, or null on failure.
 * @param recipeId  The requested recipe.
 * @param error     The failure, or null on success.
 */
public record ConversionResult(boolean success, ProcessId processId, String recipeId, ConversionError error) {

    public static ConversionResult started(ProcessId processId, String recipeId) {
        return new ConversionResult(true, processId, recipeId, null);
    }

    public static ConversionResult failed(String recipeId, ConversionError error) {
        return new ConversionResult(false, null, recipeId, error);
    }

    public Optional<ProcessId> getProcessId() {
        return Optional.ofNullable(processId);
    }

    public Optional<ConversionError> getError() {
        return Optional.ofNullable(error);
    }
}
