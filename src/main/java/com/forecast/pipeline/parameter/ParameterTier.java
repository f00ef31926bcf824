package com.forecast.pipeline.parameter;

/**
 * The source that answered a parameter lookup, highest priority first.
 */
public enum ParameterTier {
    OVERRIDE,
    CONFIGURATION,
    DEFAULT
}
