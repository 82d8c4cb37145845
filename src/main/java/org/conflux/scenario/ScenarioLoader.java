package org.conflux.scenario;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import org.conflux.runtime.model.ConversionChain;
import org.conflux.runtime.model.ConverterConfiguration;
import org.conflux.runtime.model.ConverterNode;
import org.conflux.runtime.model.Recipe;
import org.conflux.runtime.model.ResourceAmount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reads {@link Scenario}s from HOCON.
 * <p>
 * Layout:
 * <pre>
 * name = "Iron works"
 * recipes = [
 *   { id = smelt-iron, inputs { IRON_ORE = 10 }, outputs { IRON_INGOT = 5 },
 *     processing-time = 3s, base-efficiency = 1.0 }
 * ]
 * chains = [ { id = plates, steps = [smelt-iron, press-plates] } ]
 * converters = [
 *   { id = smelter-1, recipes = [smelt-iron], max-concurrent-processes = 1,
 *     efficiency = 1.0, efficiency-modifiers { smelt-iron = 1.1 }, resources { IRON_ORE = 40 } }
 * ]
 * </pre>
 * Resource maps and modifier maps are read key by key, so ids may contain dots or dashes.
 */
public final class ScenarioLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioLoader.class);

    private ScenarioLoader() {
        // Private constructor to prevent instantiation
    }

    public static Scenario load(File file) throws ScenarioException {
        if (!file.isFile()) {
            throw new ScenarioException("Scenario file not found: " + file.getPath());
        }
        LOG.info("Loading scenario from {}", file.getAbsolutePath());
        try {
            return fromConfig(ConfigFactory.parseFile(file).resolve(), file.getName());
        } catch (ConfigException e) {
            throw new ScenarioException("Cannot parse scenario " + file.getPath() + ": " + e.getMessage(), e);
        }
    }

    public static Scenario parse(String hocon) throws ScenarioException {
        try {
            return fromConfig(ConfigFactory.parseString(hocon).resolve(), "scenario");
        } catch (ConfigException e) {
            throw new ScenarioException("Cannot parse scenario: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a scenario from an already parsed configuration.
     *
     * @param defaultName name used when the configuration has no {@code name}
     */
    public static Scenario fromConfig(Config config, String defaultName) throws ScenarioException {
        try {
            String name = config.hasPath("name") ? config.getString("name") : defaultName;
            List<Recipe> recipes = new ArrayList<>();
            if (config.hasPath("recipes")) {
                for (Config entry : config.getConfigList("recipes")) {
                    recipes.add(readRecipe(entry));
                }
            }
            List<ConversionChain> chains = new ArrayList<>();
            if (config.hasPath("chains")) {
                for (Config entry : config.getConfigList("chains")) {
                    chains.add(new ConversionChain(requiredId(entry, "chain"), entry.getStringList("steps")));
                }
            }
            List<ConverterNode> converters = new ArrayList<>();
            if (config.hasPath("converters")) {
                for (Config entry : config.getConfigList("converters")) {
                    converters.add(readConverter(entry));
                }
            }
            LOG.debug("Scenario {}: {} recipe(s), {} chain(s), {} converter(s)",
                    name, recipes.size(), chains.size(), converters.size());
            return new Scenario(name, recipes, chains, converters);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ScenarioException("Invalid scenario: " + e.getMessage(), e);
        }
    }

    private static Recipe readRecipe(Config entry) throws ScenarioException {
        String id = requiredId(entry, "recipe");
        long processingTime = entry.hasPath("processing-time")
                ? entry.getDuration("processing-time", TimeUnit.MILLISECONDS)
                : 0L;
        double baseEfficiency = entry.hasPath("base-efficiency") ? entry.getDouble("base-efficiency") : 1.0;
        int requiredLevel = entry.hasPath("required-level") ? entry.getInt("required-level") : 0;
        double energyCost = entry.hasPath("energy-cost") ? entry.getDouble("energy-cost") : 0.0;
        return new Recipe(id, readAmounts(entry, "inputs"), readAmounts(entry, "outputs"), processingTime,
                baseEfficiency, requiredLevel, energyCost);
    }

    private static ConverterNode readConverter(Config entry) throws ScenarioException {
        String id = requiredId(entry, "converter");
        int capacity = entry.hasPath("max-concurrent-processes") ? entry.getInt("max-concurrent-processes") : 1;
        if (capacity < 0) {
            throw new ScenarioException("Converter " + id + " has negative max-concurrent-processes: " + capacity);
        }
        Map<String, Double> modifiers = new LinkedHashMap<>();
        if (entry.hasPath("efficiency-modifiers")) {
            for (Map.Entry<String, ConfigValue> modifier : entry.getObject("efficiency-modifiers").entrySet()) {
                modifiers.put(modifier.getKey(), number(modifier, "efficiency-modifiers").doubleValue());
            }
        }
        Map<String, Integer> resources = new LinkedHashMap<>();
        for (ResourceAmount amount : readAmounts(entry, "resources")) {
            resources.merge(amount.type(), amount.amount(), Integer::sum);
        }
        List<String> supported = entry.hasPath("recipes") ? entry.getStringList("recipes") : List.of();
        double efficiency = entry.hasPath("efficiency") ? entry.getDouble("efficiency") : 1.0;
        return new ConverterNode(id, new LinkedHashSet<>(supported), new ConverterConfiguration(capacity, modifiers),
                List.of(), efficiency, resources);
    }

    private static List<ResourceAmount> readAmounts(Config entry, String key) throws ScenarioException {
        if (!entry.hasPath(key)) {
            return List.of();
        }
        ConfigObject object = entry.getObject(key);
        List<ResourceAmount> amounts = new ArrayList<>();
        for (Map.Entry<String, ConfigValue> value : object.entrySet()) {
            amounts.add(new ResourceAmount(value.getKey(), number(value, key).intValue()));
        }
        return amounts;
    }

    private static Number number(Map.Entry<String, ConfigValue> value, String key) throws ScenarioException {
        Object unwrapped = value.getValue().unwrapped();
        if (!(unwrapped instanceof Number)) {
            throw new ScenarioException(String.format("%s.%s must be a number, got '%s'", key, value.getKey(), unwrapped));
        }
        return (Number) unwrapped;
    }

    private static String requiredId(Config entry, String kind) throws ScenarioException {
        if (!entry.hasPath("id") || entry.getString("id").isBlank()) {
            throw new ScenarioException("Every " + kind + " needs a non-blank id");
        }
        return entry.getString("id");
    }
}
