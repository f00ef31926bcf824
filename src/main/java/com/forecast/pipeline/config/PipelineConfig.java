package com.forecast.pipeline.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only shared configuration of a pipeline.
 *
 * <p>Holds per-variant parameter tables ({@code trading_rules}) and global
 * parameters ({@code parameters}). A missing variant or name is a normal
 * condition and is reported as an empty {@link Optional}.</p>
 */
public final class PipelineConfig {
    private static final PipelineConfig EMPTY = builder().build();

    private final Map<String, Map<String, Object>> tradingRules;
    private final Map<String, Object> parameters;

    private PipelineConfig(Builder builder) {
        Map<String, Map<String, Object>> rules = new LinkedHashMap<>();
        builder.tradingRules.forEach((variant, values) -> rules.put(variant, Map.copyOf(values)));
        this.tradingRules = Collections.unmodifiableMap(rules);
        this.parameters = Map.copyOf(builder.parameters);
    }

    public static PipelineConfig empty() {
        return EMPTY;
    }

    /**
     * Value of {@code name} in the table of rule variation {@code variantId}.
     */
    public Optional<Object> variantValue(String variantId, String name) {
        Map<String, Object> values = tradingRules.get(variantId);
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(name));
    }

    /**
     * Value of the global parameter {@code name}.
     */
    public Optional<Object> parameterValue(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public Set<String> variants() {
        return tradingRules.keySet();
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * Returns a builder pre-filled with this configuration.
     */
    public Builder toBuilder() {
        Builder builder = builder();
        tradingRules.forEach((variant, values) -> values.forEach((name, value) -> builder.variant(variant, name, value)));
        parameters.forEach(builder::parameter);
        return builder;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "variants=" + tradingRules.keySet() +
                ", parameters=" + parameters.keySet() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Map<String, Object>> tradingRules = new LinkedHashMap<>();
        private final Map<String, Object> parameters = new LinkedHashMap<>();

        /**
         * Sets {@code name} for variant {@code variantId}. A null value leaves the entry absent.
         */
        public Builder variant(String variantId, String name, Object value) {
            Objects.requireNonNull(variantId, "variantId is required");
            Objects.requireNonNull(name, "name is required");
            Map<String, Object> values = tradingRules.computeIfAbsent(variantId, v -> new LinkedHashMap<>());
            if (value == null) {
                values.remove(name);
            } else {
                values.put(name, value);
            }
            return this;
        }

        /**
         * Sets a global parameter. A null value leaves the entry absent.
         */
        public Builder parameter(String name, Object value) {
            Objects.requireNonNull(name, "name is required");
            if (value == null) {
                parameters.remove(name);
            } else {
                parameters.put(name, value);
            }
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
