package com.forecast.pipeline.stage;

import com.forecast.pipeline.cache.CacheAttribute;
import com.forecast.pipeline.parameter.Parameter;
import com.forecast.pipeline.parameter.ParameterOverrides;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of a stage, fixed at construction.
 *
 * @param name                the stage name, unique within a pipeline
 * @param overrides           construction-time parameter overrides
 * @param parameters          every parameter the stage resolves
 * @param invalidateOnRecalc  cache attributes cleared together on recalculation.
 *                            Callers list the full cascade; nothing is derived.
 * @param protectedAttributes cache attributes exempt from invalidation
 */
public record StageDeclaration(
        String name,
        ParameterOverrides overrides,
        Set<Parameter<?>> parameters,
        Set<CacheAttribute<?>> invalidateOnRecalc,
        Set<CacheAttribute<?>> protectedAttributes
) {
    public StageDeclaration {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(overrides, "overrides is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
        parameters = Set.copyOf(parameters);
        invalidateOnRecalc = Set.copyOf(invalidateOnRecalc);
        protectedAttributes = Set.copyOf(protectedAttributes);

        Set<CacheAttribute<?>> overlap = new HashSet<>(invalidateOnRecalc);
        overlap.retainAll(protectedAttributes);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Stage '" + name
                    + "' declares attributes both invalidated and protected: " + overlap);
        }
        for (Parameter<?> overridden : overrides.parameters()) {
            if (!parameters.contains(overridden)) {
                throw new IllegalArgumentException("Stage '" + name
                        + "' overrides undeclared parameter " + overridden.getName());
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private ParameterOverrides overrides = ParameterOverrides.none();
        private final Set<Parameter<?>> parameters = new LinkedHashSet<>();
        private final Set<CacheAttribute<?>> invalidateOnRecalc = new LinkedHashSet<>();
        private final Set<CacheAttribute<?>> protectedAttributes = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder overrides(ParameterOverrides overrides) {
            this.overrides = overrides;
            return this;
        }

        public Builder parameters(Parameter<?>... parameters) {
            this.parameters.addAll(Arrays.asList(parameters));
            return this;
        }

        public Builder invalidateOnRecalc(CacheAttribute<?>... attributes) {
            this.invalidateOnRecalc.addAll(Arrays.asList(attributes));
            return this;
        }

        public Builder protect(CacheAttribute<?>... attributes) {
            this.protectedAttributes.addAll(Arrays.asList(attributes));
            return this;
        }

        public StageDeclaration build() {
            return new StageDeclaration(name, overrides, parameters, invalidateOnRecalc, protectedAttributes);
        }
    }
}
