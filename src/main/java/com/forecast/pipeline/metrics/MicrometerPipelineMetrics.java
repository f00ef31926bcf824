package com.forecast.pipeline.metrics;

import com.forecast.pipeline.cache.CacheAttribute;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link PipelineMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code pipeline.cache.hit} - Counter (tag: attribute)</li>
 *   <li>{@code pipeline.cache.miss} - Counter (tag: attribute)</li>
 *   <li>{@code pipeline.cache.invalidated} - Counter of removed entries (tag: attribute)</li>
 *   <li>{@code pipeline.stage.compute} - Timer (tags: stage, attribute)</li>
 *   <li>{@code pipeline.stage.failure} - Counter (tags: stage, attribute)</li>
 * </ul>
 */
public class MicrometerPipelineMetrics implements PipelineMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerPipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordCacheHit(CacheAttribute<?> attribute) {
        attributeCounter("pipeline.cache.hit", "Number of stage cache hits", attribute).increment();
    }

    @Override
    public void recordCacheMiss(CacheAttribute<?> attribute) {
        attributeCounter("pipeline.cache.miss", "Number of stage cache misses", attribute).increment();
    }

    @Override
    public void recordComputeDuration(String stageName, CacheAttribute<?> attribute, Duration duration) {
        String key = stageName + ":" + attribute.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("pipeline.stage.compute")
                        .description("Duration of stage output computations")
                        .tag("stage", stageName)
                        .tag("attribute", attribute.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordComputeFailure(String stageName, CacheAttribute<?> attribute) {
        String key = "failure:" + stageName + ":" + attribute.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("pipeline.stage.failure")
                        .description("Number of failed stage output computations")
                        .tag("stage", stageName)
                        .tag("attribute", attribute.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordInvalidation(CacheAttribute<?> attribute, int entriesRemoved) {
        attributeCounter("pipeline.cache.invalidated", "Number of cache entries removed by invalidation", attribute)
                .increment(entriesRemoved);
    }

    private Counter attributeCounter(String name, String description, CacheAttribute<?> attribute) {
        return counterCache.computeIfAbsent(name + ":" + attribute.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("attribute", attribute.name())
                        .register(registry));
    }
}
