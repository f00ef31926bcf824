package com.forecast.pipeline.parameter;

import java.util.Map;
import java.util.Optional;

/**
 * Construction-time override of a parameter, the highest-priority resolution tier.
 * Presence is judged per variant: an override that has nothing for a variant
 * defers to configuration.
 */
@FunctionalInterface
public interface ParameterOverride<T> {

    /**
     * Returns the overriding value for {@code variantId}, or empty to defer.
     */
    Optional<T> lookup(String variantId);

    /**
     * One value for every variant. A {@code null} value defers for all variants.
     */
    static <T> ParameterOverride<T> forAllVariants(T value) {
        Optional<T> result = Optional.ofNullable(value);
        return variantId -> result;
    }

    /**
     * Per-variant values; variants missing from the map (and every variant,
     * if the map is empty) defer.
     */
    static <T> ParameterOverride<T> perVariant(Map<String, ? extends T> values) {
        Map<String, T> copy = Map.copyOf(values);
        return variantId -> Optional.ofNullable(copy.get(variantId));
    }

    static <T> ParameterOverride<T> absent() {
        return variantId -> Optional.empty();
    }
}
