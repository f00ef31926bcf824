package com.forecast.pipeline.stage;

import com.forecast.pipeline.core.PipelineException;
import com.forecast.pipeline.core.model.CompositeKey;
import com.forecast.pipeline.core.model.LabeledSeries;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SeriesSource} backed by a map. Useful for tests and for feeding
 * precomputed forecasts into a pipeline.
 */
public class InMemorySeriesSource implements SeriesSource {

    private final Map<CompositeKey, LabeledSeries> series = new ConcurrentHashMap<>();

    public InMemorySeriesSource put(String entityId, String variantId, LabeledSeries value) {
        series.put(CompositeKey.of(entityId, variantId), value);
        return this;
    }

    @Override
    public LabeledSeries getSeries(String entityId, String variantId) {
        LabeledSeries value = series.get(CompositeKey.of(entityId, variantId));
        if (value == null) {
            throw new PipelineException("No series for " + entityId + "/" + variantId);
        }
        return value;
    }
}
