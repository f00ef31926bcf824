package com.forecast.pipeline.parameter;

import com.forecast.pipeline.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves stage parameters from three tiers, highest priority first:
 * <ol>
 *   <li>the stage's construction-time override for the variant,</li>
 *   <li>the shared configuration ({@code trading_rules[variant][name]} or
 *       {@code parameters[name]}, depending on the parameter's scope),</li>
 *   <li>the default table.</li>
 * </ol>
 * Absence in the first two tiers falls through; absence in the default table
 * throws {@link DefaultMissingException}. The chain holds no mutable state, so
 * identical inputs always resolve identically and results are safe to memoize.
 */
public class ResolutionChain {
    private static final Logger log = LoggerFactory.getLogger(ResolutionChain.class);

    private final ParameterOverrides overrides;
    private final PipelineConfig config;
    private final DefaultTable defaults;

    public ResolutionChain(ParameterOverrides overrides, PipelineConfig config, DefaultTable defaults) {
        this.overrides = Objects.requireNonNull(overrides, "overrides is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.defaults = Objects.requireNonNull(defaults, "defaults is required");
    }

    /**
     * Resolves {@code parameter} for an {@code (entity, variant)} pair.
     *
     * @throws DefaultMissingException   if no tier has a value
     * @throws InvalidParameterException if the value found cannot be converted
     */
    public <T> T resolve(Parameter<T> parameter, String entityId, String variantId) {
        return resolveWithSource(parameter, entityId, variantId).value();
    }

    /**
     * Like {@link #resolve} but also reports which tier supplied the value.
     */
    public <T> ResolvedParameter<T> resolveWithSource(Parameter<T> parameter, String entityId, String variantId) {
        ResolvedParameter<T> resolved = fromOverride(parameter, variantId)
                .or(() -> fromConfiguration(parameter, variantId))
                .orElseGet(() -> fromDefaults(parameter));
        log.debug("Resolved {} for {}/{} from {}: {}",
                parameter.getName(), entityId, variantId, resolved.tier(), resolved.value());
        return resolved;
    }

    private <T> Optional<ResolvedParameter<T>> fromOverride(Parameter<T> parameter, String variantId) {
        return overrides.lookup(parameter, variantId)
                .map(value -> new ResolvedParameter<>(parameter, value, ParameterTier.OVERRIDE));
    }

    private <T> Optional<ResolvedParameter<T>> fromConfiguration(Parameter<T> parameter, String variantId) {
        Optional<Object> raw = switch (parameter.getScope()) {
            case PER_VARIANT -> config.variantValue(variantId, parameter.getName());
            case GLOBAL -> config.parameterValue(parameter.getName());
        };
        return raw.map(value -> new ResolvedParameter<>(parameter, parameter.convert(value), ParameterTier.CONFIGURATION));
    }

    private <T> ResolvedParameter<T> fromDefaults(Parameter<T> parameter) {
        Object raw = defaults.lookup(parameter.getName())
                .orElseThrow(() -> new DefaultMissingException(parameter.getName()));
        return new ResolvedParameter<>(parameter, parameter.convert(raw), ParameterTier.DEFAULT);
    }
}
