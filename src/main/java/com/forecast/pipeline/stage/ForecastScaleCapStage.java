package com.forecast.pipeline.stage;

import com.forecast.pipeline.cache.CacheAttribute;
import com.forecast.pipeline.core.model.LabeledSeries;
import com.forecast.pipeline.parameter.InvalidParameterException;
import com.forecast.pipeline.parameter.Parameter;
import com.forecast.pipeline.parameter.ParameterOverride;
import com.forecast.pipeline.parameter.ParameterOverrides;
import com.forecast.pipeline.parameter.ParameterScope;

import java.util.Map;

/**
 * Stage {@value #NAME}: scales raw forecasts by a fixed scalar and caps them.
 *
 * <p>KEY INPUT: {@code rules} stage output {@link RawForecastStage#RAW_FORECAST}<br>
 * KEY OUTPUT: {@link #CAPPED_FORECAST}</p>
 *
 * <p>The forecast scalar is a per-rule-variation parameter; the cap is global.
 * Both come from, in order: the values passed to the constructor, the pipeline
 * configuration, the system defaults.</p>
 */
public class ForecastScaleCapStage extends PipelineStage {

    public static final String NAME = "forecastScaleCap";

    public static final Parameter<Double> FORECAST_SCALAR =
            Parameter.ofDouble("forecast_scalar", ParameterScope.PER_VARIANT);
    public static final Parameter<Double> FORECAST_CAP =
            Parameter.ofDouble("forecast_cap", ParameterScope.GLOBAL);

    public static final CacheAttribute<Double> FORECAST_SCALARS =
            CacheAttribute.of("forecast_scalars", Double.class);
    public static final CacheAttribute<Double> FORECAST_CAP_VALUE =
            CacheAttribute.of("forecast_cap", Double.class);
    public static final CacheAttribute<LabeledSeries> SCALED_FORECAST =
            CacheAttribute.of("scaled_forecast", LabeledSeries.class);
    public static final CacheAttribute<LabeledSeries> CAPPED_FORECAST =
            CacheAttribute.of("capped_forecast", LabeledSeries.class);

    public ForecastScaleCapStage() {
        this(Map.of(), null);
    }

    /**
     * @param forecastScalars scalars keyed by rule variation name; variations not
     *                        listed fall back to configuration
     * @param forecastCap     cap for every variation, or {@code null} to fall back
     */
    public ForecastScaleCapStage(Map<String, Double> forecastScalars, Double forecastCap) {
        super(StageDeclaration.builder(NAME)
                .parameters(FORECAST_SCALAR, FORECAST_CAP)
                .overrides(ParameterOverrides.builder()
                        .put(FORECAST_SCALAR, ParameterOverride.perVariant(forecastScalars))
                        .put(FORECAST_CAP, ParameterOverride.forAllVariants(forecastCap))
                        .build())
                .invalidateOnRecalc(FORECAST_SCALARS, SCALED_FORECAST, FORECAST_CAP_VALUE, CAPPED_FORECAST)
                .build());
        defineOutput(SCALED_FORECAST, this::getScaledForecast);
        defineOutput(CAPPED_FORECAST, this::getCappedForecast);
    }

    /**
     * Raw forecast from the upstream {@code rules} stage. Not cached here.
     */
    public LabeledSeries getRawForecast(String instrumentCode, String ruleVariationName) {
        return upstream(RawForecastStage.NAME)
                .getOutput(RawForecastStage.RAW_FORECAST, instrumentCode, ruleVariationName);
    }

    public double getForecastScalar(String instrumentCode, String ruleVariationName) {
        return cached(FORECAST_SCALARS, instrumentCode, ruleVariationName,
                () -> resolveParameter(FORECAST_SCALAR, instrumentCode, ruleVariationName));
    }

    public double getForecastCap(String instrumentCode, String ruleVariationName) {
        return cached(FORECAST_CAP_VALUE, instrumentCode, ruleVariationName, () -> {
            double cap = resolveParameter(FORECAST_CAP, instrumentCode, ruleVariationName);
            if (!(cap > 0)) {
                throw new InvalidParameterException(FORECAST_CAP.getName(), "cap must be positive, got " + cap);
            }
            return cap;
        });
    }

    public LabeledSeries getScaledForecast(String instrumentCode, String ruleVariationName) {
        return cached(SCALED_FORECAST, instrumentCode, ruleVariationName, () -> {
            LabeledSeries raw = getRawForecast(instrumentCode, ruleVariationName);
            double scalar = getForecastScalar(instrumentCode, ruleVariationName);
            return checkShape(SCALED_FORECAST, raw, raw.map(value -> value * scalar));
        });
    }

    /**
     * Scaled forecast clamped to {@code [-cap, cap]}. NaN stays NaN.
     */
    public LabeledSeries getCappedForecast(String instrumentCode, String ruleVariationName) {
        return cached(CAPPED_FORECAST, instrumentCode, ruleVariationName, () -> {
            LabeledSeries scaled = getScaledForecast(instrumentCode, ruleVariationName);
            double cap = getForecastCap(instrumentCode, ruleVariationName);
            return checkShape(CAPPED_FORECAST, scaled, scaled.map(value -> Math.max(-cap, Math.min(cap, value))));
        });
    }
}
