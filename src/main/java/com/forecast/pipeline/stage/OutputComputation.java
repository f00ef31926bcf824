package com.forecast.pipeline.stage;

import com.forecast.pipeline.core.model.LabeledSeries;

/**
 * A named stage output for one {@code (entity, variant)} pair.
 */
@FunctionalInterface
public interface OutputComputation {

    LabeledSeries compute(String entityId, String variantId);
}
