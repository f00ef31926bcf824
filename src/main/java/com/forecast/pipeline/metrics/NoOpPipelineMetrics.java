package com.forecast.pipeline.metrics;

import com.forecast.pipeline.cache.CacheAttribute;

import java.time.Duration;

/**
 * No-op implementation of {@link PipelineMetrics}.
 */
public class NoOpPipelineMetrics implements PipelineMetrics {

    @Override
    public void recordCacheHit(CacheAttribute<?> attribute) {
    }

    @Override
    public void recordCacheMiss(CacheAttribute<?> attribute) {
    }

    @Override
    public void recordComputeDuration(String stageName, CacheAttribute<?> attribute, Duration duration) {
    }

    @Override
    public void recordComputeFailure(String stageName, CacheAttribute<?> attribute) {
    }

    @Override
    public void recordInvalidation(CacheAttribute<?> attribute, int entriesRemoved) {
    }
}
