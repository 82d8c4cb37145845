package org.conflux.runtime.model;

import java.util.List;

/**
 * Declarative input-to-output transformation executed by a converter.
 * <p>
 * Recipes are immutable. Registering a recipe under an id that is already known replaces
 * the previous definition; processes that already started keep the efficiency they captured.
 *
 * @param id                 Unique recipe id. Registration rejects a null or blank id.
 * @param inputs             Resources consumed when a process starts.
 * @param outputs            Resources produced (before efficiency) when a process completes.
 * @param processingTimeMs   Duration of one process in milliseconds.
 * @param baseEfficiency     Recipe-level efficiency multiplier.
 * @param requiredLevel      Minimum tech level needed to use the recipe (informational).
 * @param energyCost         Energy cost of one run (informational).
 */
public record Recipe(
        String id,
        List<ResourceAmount> inputs,
        List<ResourceAmount> outputs,
        long processingTimeMs,
        double baseEfficiency,
        int requiredLevel,
        double energyCost
) {

    public Recipe {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must be >= 0");
        }
    }

    /**
     * Convenience factory for the common case without level or energy requirements.
     */
    public static Recipe of(String id, List<ResourceAmount> inputs, List<ResourceAmount> outputs,
                            long processingTimeMs, double baseEfficiency) {
        return new Recipe(id, inputs, outputs, processingTimeMs, baseEfficiency, 0, 0.0);
    }
}
