package org.conflux.runtime.model;

import java.util.Objects;

/**
 * Identifier of one execution of a conversion chain.
 *
 * @param value the raw id
 */
public record ChainExecutionId(String value) {

    public ChainExecutionId {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
