package org.conflux.runtime.model;

import java.util.List;

/**
 * An ordered sequence of recipe ids executed step by step, possibly on different converters.
 * The definition is independent of any running execution.
 *
 * @param id    Unique chain id.
 * @param steps Recipe ids in execution order.
 */
public record ConversionChain(String id, List<String> steps) {

    public ConversionChain {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
