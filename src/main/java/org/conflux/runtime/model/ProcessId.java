package org.conflux.runtime.model;

import java.util.Objects;

/**
 * Identifier of a conversion process.
 *
 * @param value the raw id as stored on converter nodes
 */
public record ProcessId(String value) {

    public ProcessId {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
