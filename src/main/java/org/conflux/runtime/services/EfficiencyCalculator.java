package org.conflux.runtime.services;

import org.conflux.runtime.Config;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.Recipe;
import org.conflux.runtime.model.ResourceAmount;

import java.util.List;

/**
 * Combines recipe, converter, modifier, input-quality and load factors into one efficiency
 * multiplier.
 * <p>
 * The calculation is a pure function of its arguments:
 * <pre>
 *   raw = recipe.baseEfficiency
 *       * converter.efficiency
 *       * converter.configuration.efficiencyModifiers[recipe.id] (default 1)
 *       * resourceQualityFactor(recipe.inputs)
 *       * networkStressFactor(converter)
 * </pre>
 * {@link #calculate} returns the raw value; {@link #calculateApplied} clamps it to [0, 2].
 */
public class EfficiencyCalculator {

    /**
     * Computes the unclamped efficiency of running {@code recipe} on {@code converter}.
     */
    public double calculate(ConverterNode converter, Recipe recipe) {
        double efficiency = recipe.baseEfficiency();
        efficiency *= converter.efficiency();
        efficiency *= converter.configuration().modifierFor(recipe.id());
        efficiency *= resourceQualityFactor(recipe.inputs());
        efficiency *= networkStressFactor(converter);
        return efficiency;
    }

    /**
     * Computes the efficiency clamped into the applied range.
     */
    public double calculateApplied(ConverterNode converter, Recipe recipe) {
        return Config.clampEfficiency(calculate(converter, recipe));
    }

    /**
     * Quality factor of the given inputs. Resources carry no quality attribute yet, so this is neutral.
     */
    public double resourceQualityFactor(List<ResourceAmount> inputs) {
        return Config.NEUTRAL_QUALITY_FACTOR;
    }

    /**
     * Load-dependent degradation: {@code 1 - load * 0.2}, clamped to [0.5, 1.0], where load is the
     * ratio of active processes to capacity. A converter without usable capacity is not penalized.
     */
    public double networkStressFactor(ConverterNode converter) {
        int maxProcesses = converter.configuration().maxConcurrentProcesses();
        if (maxProcesses <= 0) {
            return 1.0;
        }
        double loadRatio = (double) converter.activeProcessIds().size() / maxProcesses;
        double factor = 1.0 - loadRatio * Config.MAX_STRESS_PENALTY;
        return Math.max(Config.MIN_STRESS_FACTOR, Math.min(factor, 1.0));
    }
}
