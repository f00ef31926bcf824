package com.forecast.pipeline.parameter;

/**
 * Where a parameter lives in the shared configuration.
 */
public enum ParameterScope {
    /** Read from {@code trading_rules[variant][name]}. */
    PER_VARIANT,
    /** Read from {@code parameters[name]}, the same for every variant. */
    GLOBAL
}
