package com.forecast.pipeline.parameter;

import com.forecast.pipeline.core.PipelineException;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when the default table has no entry for a parameter that fell through
 * both the override and the configuration tier. This is a defect in the default
 * table, never a normal fallback.
 */
public class DefaultMissingException extends PipelineException {

    private final List<String> parameterNames;

    public DefaultMissingException(String parameterName) {
        super("No system default for parameter '" + parameterName + "'");
        this.parameterNames = List.of(parameterName);
    }

    public DefaultMissingException(Collection<String> parameterNames) {
        super("No system default for parameters " + parameterNames);
        this.parameterNames = List.copyOf(parameterNames);
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }
}
