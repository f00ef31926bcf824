package com.forecast.pipeline.metrics;

import com.forecast.pipeline.cache.CacheAttribute;

import java.time.Duration;

/**
 * Interface for recording pipeline cache and stage metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpPipelineMetrics} does nothing, so the library works
 * without a meter registry.
 */
public interface PipelineMetrics {

    void recordCacheHit(CacheAttribute<?> attribute);

    void recordCacheMiss(CacheAttribute<?> attribute);

    void recordComputeDuration(String stageName, CacheAttribute<?> attribute, Duration duration);

    void recordComputeFailure(String stageName, CacheAttribute<?> attribute);

    void recordInvalidation(CacheAttribute<?> attribute, int entriesRemoved);
}
