package com.forecast.pipeline.stage;

import com.forecast.pipeline.cache.CacheAttribute;
import com.forecast.pipeline.core.PipelineException;
import com.forecast.pipeline.core.model.LabeledSeries;

import java.util.Objects;

/**
 * Stage {@value #NAME}: memoizes raw forecasts read from a {@link SeriesSource}.
 *
 * <p>KEY OUTPUT: {@link #RAW_FORECAST}</p>
 */
public class RawForecastStage extends PipelineStage {

    public static final String NAME = "rules";

    public static final CacheAttribute<LabeledSeries> RAW_FORECAST =
            CacheAttribute.of("raw_forecast", LabeledSeries.class);

    private final SeriesSource source;

    public RawForecastStage(SeriesSource source) {
        super(StageDeclaration.builder(NAME)
                .invalidateOnRecalc(RAW_FORECAST)
                .build());
        this.source = Objects.requireNonNull(source, "source is required");
        defineOutput(RAW_FORECAST, this::getRawForecast);
    }

    public LabeledSeries getRawForecast(String instrumentCode, String ruleVariationName) {
        return cached(RAW_FORECAST, instrumentCode, ruleVariationName, () -> {
            LabeledSeries series = source.getSeries(instrumentCode, ruleVariationName);
            if (series == null) {
                throw new PipelineException("Series source returned no forecast for "
                        + instrumentCode + "/" + ruleVariationName);
            }
            return series;
        });
    }
}
