package org.conflux.runtime.model;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A partial update of a converter node. Absent fields are left untouched.
 */
public final class ConverterNodeUpdate {

    private final List<String> activeProcessIds;
    private final Double efficiency;

    private ConverterNodeUpdate(List<String> activeProcessIds, Double efficiency) {
        this.activeProcessIds = activeProcessIds == null ? null : List.copyOf(activeProcessIds);
        this.efficiency = efficiency;
    }

    public static ConverterNodeUpdate activeProcessIds(List<String> activeProcessIds) {
        return new ConverterNodeUpdate(activeProcessIds, null);
    }

    public static ConverterNodeUpdate efficiency(double efficiency) {
        return new ConverterNodeUpdate(null, efficiency);
    }

    public Optional<List<String>> getActiveProcessIds() {
        return Optional.ofNullable(activeProcessIds);
    }

    public OptionalDouble getEfficiency() {
        return efficiency == null ? OptionalDouble.empty() : OptionalDouble.of(efficiency);
    }

    @Override
    public String toString() {
        return "ConverterNodeUpdate{activeProcessIds=" + activeProcessIds + ", efficiency=" + efficiency + '}';
    }
}
