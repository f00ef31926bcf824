package com.forecast.pipeline.parameter;

/**
 * A resolved parameter value together with the tier that supplied it.
 */
public record ResolvedParameter<T>(Parameter<T> parameter, T value, ParameterTier tier) {
}
