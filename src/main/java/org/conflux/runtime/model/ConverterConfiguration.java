package org.conflux.runtime.model;

import java.util.Map;

/**
 * Static configuration of a converter node.
 *
 * @param maxConcurrentProcesses Number of processes the converter may run at the same time.
 * @param efficiencyModifiers    Per-recipe efficiency multipliers keyed by recipe id.
 */
public record ConverterConfiguration(int maxConcurrentProcesses, Map<String, Double> efficiencyModifiers) {

    public ConverterConfiguration {
        efficiencyModifiers = efficiencyModifiers == null ? Map.of() : Map.copyOf(efficiencyModifiers);
    }

    /**
     * Returns the modifier for a recipe, or 1.0 if none is configured.
     */
    public double modifierFor(String recipeId) {
        Double modifier = efficiencyModifiers.get(recipeId);
        return modifier != null ? modifier : 1.0;
    }
}
