package com.forecast.pipeline.parameter;

import com.forecast.pipeline.core.PipelineException;

/**
 * Thrown when a configured or default value cannot be converted to the
 * parameter's declared type.
 */
public class InvalidParameterException extends PipelineException {

    public InvalidParameterException(String parameterName, Object value, Class<?> expectedType) {
        super("Parameter '" + parameterName + "' has value '" + value + "' of type "
                + (value == null ? "null" : value.getClass().getSimpleName())
                + ", expected " + expectedType.getSimpleName());
    }

    public InvalidParameterException(String parameterName, String reason) {
        super("Parameter '" + parameterName + "' is invalid: " + reason);
    }
}
