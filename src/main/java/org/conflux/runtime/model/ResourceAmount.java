package org.conflux.runtime.model;

import java.util.Objects;

/**
 * An amount of a single resource type, used for recipe inputs, outputs and transfers.
 *
 * @param type   The resource type identifier (e.g. "MINERALS").
 * @param amount The quantity, never negative.
 */
public record ResourceAmount(String type, int amount) {

    public ResourceAmount {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Resource type must not be blank");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Resource amount must not be negative: " + amount);
        }
    }

    /**
     * Returns a copy scaled by the given efficiency, rounded down and capped at
     * {@link Integer#MAX_VALUE}.
     *
     * @param efficiency multiplier, expected to be already clamped
     * @return the scaled amount
     */
    public ResourceAmount scaled(double efficiency) {
        double scaled = Math.floor((double) amount * efficiency);
        return new ResourceAmount(type, scaled >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) scaled);
    }
}
