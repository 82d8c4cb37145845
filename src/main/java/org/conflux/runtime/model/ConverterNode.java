package org.conflux.runtime.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a converter node as reported by the converter directory.
 * <p>
 * The engine never keeps a second copy of node state. It fetches a fresh snapshot before every
 * decision and mutates the node only through the directory.
 *
 * @param id                 Node id.
 * @param supportedRecipeIds Recipes this converter can run.
 * @param configuration      Capacity and efficiency modifiers.
 * @param activeProcessIds   Ids of processes currently running on the node.
 * @param efficiency         Node-level efficiency multiplier.
 * @param resources          The node's resource pool, keyed by resource type.
 */
public record ConverterNode(
        String id,
        Set<String> supportedRecipeIds,
        ConverterConfiguration configuration,
        List<String> activeProcessIds,
        double efficiency,
        Map<String, Integer> resources
) {

    public ConverterNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(configuration, "configuration");
        supportedRecipeIds = supportedRecipeIds == null ? Set.of() : Set.copyOf(supportedRecipeIds);
        activeProcessIds = activeProcessIds == null ? List.of() : List.copyOf(activeProcessIds);
        resources = resources == null ? Map.of() : Map.copyOf(resources);
    }

    public boolean supports(String recipeId) {
        return supportedRecipeIds.contains(recipeId);
    }

    public boolean hasSpareCapacity() {
        return activeProcessIds.size() < configuration.maxConcurrentProcesses();
    }

    public int resourceAmount(String type) {
        return resources.getOrDefault(type, 0);
    }
}
