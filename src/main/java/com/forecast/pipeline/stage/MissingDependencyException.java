package com.forecast.pipeline.stage;

import com.forecast.pipeline.core.PipelineException;

/**
 * Thrown when a stage reads from an upstream stage that is not registered in
 * its pipeline, or that is registered after it.
 */
public class MissingDependencyException extends PipelineException {

    private final String requiredStage;

    public MissingDependencyException(String requiredStage, String message) {
        super(message);
        this.requiredStage = requiredStage;
    }

    /**
     * Name of the upstream stage that could not be read.
     */
    public String getRequiredStage() {
        return requiredStage;
    }
}
