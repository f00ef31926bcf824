package com.forecast.pipeline.metrics;

import com.forecast.pipeline.api.Pipeline;
import com.forecast.pipeline.cache.CacheAttribute;
import com.forecast.pipeline.core.model.LabeledSeries;
import com.forecast.pipeline.stage.ForecastScaleCapStage;
import com.forecast.pipeline.stage.InMemorySeriesSource;
import com.forecast.pipeline.stage.RawForecastStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("PipelineMetrics Tests")
class PipelineMetricsTest {

    private static final CacheAttribute<Double> SCALAR = CacheAttribute.of("forecast_scalars", Double.class);

    @Nested
    @DisplayName("NoOpPipelineMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpPipelineMetrics noOp = new NoOpPipelineMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordCacheHit(SCALAR);
                noOp.recordCacheMiss(SCALAR);
                noOp.recordComputeDuration("forecastScaleCap", SCALAR, Duration.ofMillis(3));
                noOp.recordComputeFailure("forecastScaleCap", SCALAR);
                noOp.recordInvalidation(SCALAR, 4);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerPipelineMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerPipelineMetrics metrics = new MicrometerPipelineMetrics(registry);

        @Test
        @DisplayName("Should count hits and misses per attribute")
        void recordHitsAndMisses() {
            metrics.recordCacheHit(SCALAR);
            metrics.recordCacheHit(SCALAR);
            metrics.recordCacheMiss(SCALAR);

            Counter hits = registry.find("pipeline.cache.hit").tag("attribute", "forecast_scalars").counter();
            Counter misses = registry.find("pipeline.cache.miss").tag("attribute", "forecast_scalars").counter();
            assertNotNull(hits);
            assertEquals(2.0, hits.count());
            assertNotNull(misses);
            assertEquals(1.0, misses.count());
        }

        @Test
        @DisplayName("Should record compute duration as timer")
        void recordComputeDuration() {
            metrics.recordComputeDuration("forecastScaleCap", SCALAR, Duration.ofMillis(5));
            metrics.recordComputeDuration("forecastScaleCap", SCALAR, Duration.ofMillis(7));

            Timer timer = registry.find("pipeline.stage.compute")
                    .tag("stage", "forecastScaleCap")
                    .tag("attribute", "forecast_scalars")
                    .timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should count failures and invalidated entries")
        void recordFailuresAndInvalidations() {
            metrics.recordComputeFailure("forecastScaleCap", SCALAR);
            metrics.recordInvalidation(SCALAR, 3);
            metrics.recordInvalidation(SCALAR, 2);

            assertEquals(1.0, registry.find("pipeline.stage.failure").counter().count());
            assertEquals(5.0, registry.find("pipeline.cache.invalidated").counter().count());
        }

        @Test
        @DisplayName("Pipeline should report through its metrics")
        void pipelineIntegration() {
            InMemorySeriesSource source = new InMemorySeriesSource()
                    .put("X", "v", LabeledSeries.of("v", List.of(LocalDate.of(2015, 4, 21)), 1.0));
            Pipeline pipeline = Pipeline.builder()
                    .metrics(metrics)
                    .stages(new RawForecastStage(source), new ForecastScaleCapStage())
                    .build();
            ForecastScaleCapStage scaleCap = pipeline.stage(ForecastScaleCapStage.NAME, ForecastScaleCapStage.class);

            scaleCap.getCappedForecast("X", "v");
            scaleCap.getCappedForecast("X", "v");

            assertEquals(1.0, registry.find("pipeline.cache.hit").tag("attribute", "capped_forecast").counter().count());
            assertEquals(1, registry.find("pipeline.stage.compute").tag("attribute", "raw_forecast").timer().count());
        }
    }

    @Test
    @DisplayName("Failed computations are reported to the metrics service")
    void failureReported() {
        PipelineMetrics metrics = mock(PipelineMetrics.class);
        Pipeline pipeline = Pipeline.builder()
                .metrics(metrics)
                .stages(new RawForecastStage(new InMemorySeriesSource()), new ForecastScaleCapStage())
                .build();
        ForecastScaleCapStage scaleCap = pipeline.stage(ForecastScaleCapStage.NAME, ForecastScaleCapStage.class);

        assertThrows(RuntimeException.class, () -> scaleCap.getCappedForecast("X", "v"));

        verify(metrics).recordComputeFailure(RawForecastStage.NAME, RawForecastStage.RAW_FORECAST);
        verify(metrics).recordComputeFailure(ForecastScaleCapStage.NAME, ForecastScaleCapStage.CAPPED_FORECAST);
        verify(metrics, never()).recordComputeDuration(eq(ForecastScaleCapStage.NAME),
                eq(ForecastScaleCapStage.CAPPED_FORECAST), any(Duration.class));
    }
}
