package org.conflux.scenario;

import org.conflux.runtime.model.ConversionChain;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.Recipe;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A self-contained economy: recipes, chains and the converter nodes that run them.
 *
 * @param name       Display name.
 * @param recipes    Recipe definitions.
 * @param chains     Chain definitions.
 * @param converters Converter nodes with their initial resource pools.
 */
public record Scenario(String name, List<Recipe> recipes, List<ConversionChain> chains, List<ConverterNode> converters) {

    public Scenario {
        recipes = List.copyOf(recipes);
        chains = List.copyOf(chains);
        converters = List.copyOf(converters);
    }

    public Optional<ConversionChain> findChain(String chainId) {
        return chains.stream().filter(c -> c.id().equals(chainId)).findFirst();
    }

    /**
     * Checks the scenario for definitions that can never run.
     *
     * @return human-readable problems, empty if the scenario is consistent
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Set<String> recipeIds = new LinkedHashSet<>();
        for (Recipe recipe : recipes) {
            if (!recipeIds.add(recipe.id())) {
                problems.add("Recipe " + recipe.id() + " is defined more than once");
            }
        }
        Set<String> chainIds = new LinkedHashSet<>();
        for (ConversionChain chain : chains) {
            if (!chainIds.add(chain.id())) {
                problems.add("Chain " + chain.id() + " is defined more than once");
            }
            if (chain.steps().isEmpty()) {
                problems.add("Chain " + chain.id() + " has no steps");
            }
            for (String step : chain.steps()) {
                if (!recipeIds.contains(step)) {
                    problems.add("Chain " + chain.id() + " references unknown recipe " + step);
                }
            }
        }
        for (Recipe recipe : recipes) {
            boolean supported = converters.stream().anyMatch(node -> node.supports(recipe.id()));
            if (!supported) {
                problems.add("No converter supports recipe " + recipe.id());
            }
        }
        Set<String> converterIds = new LinkedHashSet<>();
        for (ConverterNode node : converters) {
            if (!converterIds.add(node.id())) {
                problems.add("Converter " + node.id() + " is defined more than once");
            }
            for (String recipeId : node.supportedRecipeIds()) {
                if (!recipeIds.contains(recipeId)) {
                    problems.add("Converter " + node.id() + " lists unknown recipe " + recipeId);
                }
            }
        }
        return problems;
    }
}
