package com.servealert.synthesis;

import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Roulette-wheel selection over a list of weighted items.
 *
 * <p>Draws {@code r = random.nextDouble() * totalWeight}, then walks the list subtracting
 * each weight and returns the first item that brings {@code r} to zero or below. The
 * first item is returned when the walk runs off the end (all weights zero or rounding).
 * Given a seeded or stubbed {@link Random} the pick is fully deterministic.
 */
public final class WeightedSelector {

    private WeightedSelector() {}

    public static <T> T select(List<T> items, ToDoubleFunction<T> weight, Random random) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot select from an empty list");
        }
        double total = 0;
        for (T item : items) {
            total += weight.applyAsDouble(item);
        }
        double remaining = random.nextDouble() * total;
        for (T item : items) {
            remaining -= weight.applyAsDouble(item);
            if (remaining <= 0) {
                return item;
            }
        }
        return items.get(0);
    }
}
