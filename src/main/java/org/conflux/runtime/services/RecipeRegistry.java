package org.conflux.runtime.services;

import org.conflux.runtime.model.ConversionChain;
import org.conflux.runtime.model.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the immutable recipe and chain definitions.
 * <p>
 * Registration is insert-or-overwrite. Chains are not validated against the known recipes; a
 * chain step referring to an unknown recipe fails only when the step is reached.
 */
public class RecipeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeRegistry.class);

    private final Map<String, Recipe> recipes = new LinkedHashMap<>();
    private final Map<String, ConversionChain> chains = new LinkedHashMap<>();

    /**
     * Registers or replaces a recipe.
     *
     * @return false if the recipe or its id is missing
     */
    public boolean registerRecipe(Recipe recipe) {
        if (recipe == null || isBlank(recipe.id())) {
            return false;
        }
        Recipe previous = recipes.put(recipe.id(), recipe);
        if (previous != null) {
            LOG.debug("Recipe {} replaced", recipe.id());
        }
        return true;
    }

    /**
     * Registers or replaces a chain.
     *
     * @return false if the chain or its id is missing
     */
    public boolean registerChain(ConversionChain chain) {
        if (chain == null || isBlank(chain.id())) {
            return false;
        }
        ConversionChain previous = chains.put(chain.id(), chain);
        if (previous != null) {
            LOG.debug("Chain {} replaced", chain.id());
        }
        return true;
    }

    public Optional<Recipe> findRecipe(String recipeId) {
        return recipeId == null ? Optional.empty() : Optional.ofNullable(recipes.get(recipeId));
    }

    public Optional<ConversionChain> findChain(String chainId) {
        return chainId == null ? Optional.empty() : Optional.ofNullable(chains.get(chainId));
    }

    public List<Recipe> getRecipes() {
        return new ArrayList<>(recipes.values());
    }

    public List<ConversionChain> getChains() {
        return new ArrayList<>(chains.values());
    }

    public void clear() {
        recipes.clear();
        chains.clear();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
