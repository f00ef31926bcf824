package com.forecast.pipeline.stage;

import com.forecast.pipeline.core.model.LabeledSeries;

/**
 * Supplies raw forecast series. Implementations must be deterministic for a
 * fixed pipeline configuration; the series is cached by the consuming stage.
 */
@FunctionalInterface
public interface SeriesSource {

    /**
     * @param entityId  instrument code
     * @param variantId rule variation name
     * @return the raw series, never {@code null}
     */
    LabeledSeries getSeries(String entityId, String variantId);
}
