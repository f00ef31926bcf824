package com.forecast.pipeline.core;

/**
 * Base runtime exception for failures surfaced by the forecast pipeline.
 * Absent overrides and absent configuration entries are never reported this way;
 * only conditions the caller of an output retrieval has to see are.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
