package com.forecast.pipeline.parameter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of construction-time overrides, keyed by parameter.
 */
public final class ParameterOverrides {
    private static final ParameterOverrides NONE = new ParameterOverrides(Map.of());

    private final Map<Parameter<?>, ParameterOverride<?>> overrides;

    private ParameterOverrides(Map<Parameter<?>, ParameterOverride<?>> overrides) {
        this.overrides = Map.copyOf(overrides);
    }

    public static ParameterOverrides none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the override value of {@code parameter} for {@code variantId}, if any.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> lookup(Parameter<T> parameter, String variantId) {
        ParameterOverride<T> override = (ParameterOverride<T>) overrides.get(parameter);
        return override == null ? Optional.empty() : override.lookup(variantId);
    }

    public Set<Parameter<?>> parameters() {
        return overrides.keySet();
    }

    public static class Builder {
        private final Map<Parameter<?>, ParameterOverride<?>> overrides = new LinkedHashMap<>();

        public <T> Builder put(Parameter<T> parameter, ParameterOverride<T> override) {
            overrides.put(Objects.requireNonNull(parameter, "parameter is required"),
                    Objects.requireNonNull(override, "override is required"));
            return this;
        }

        public ParameterOverrides build() {
            return new ParameterOverrides(overrides);
        }
    }
}
