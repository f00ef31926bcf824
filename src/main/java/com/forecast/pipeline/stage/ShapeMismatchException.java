package com.forecast.pipeline.stage;

import com.forecast.pipeline.core.PipelineException;
import com.forecast.pipeline.core.model.LabeledSeries;

/**
 * Thrown when a stage output does not have the name, length and index of the
 * series it was computed from.
 */
public class ShapeMismatchException extends PipelineException {

    public ShapeMismatchException(String stageName, String outputName, LabeledSeries input, LabeledSeries output) {
        super("Stage '" + stageName + "' produced " + outputName + " " + describe(output)
                + " from input " + describe(input));
    }

    private static String describe(LabeledSeries series) {
        return series == null ? "null" : "'" + series.getName() + "' of length " + series.size();
    }
}
