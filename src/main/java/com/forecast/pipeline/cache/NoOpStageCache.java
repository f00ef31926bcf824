package com.forecast.pipeline.cache;

import com.forecast.pipeline.core.model.CompositeKey;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * No-op cache implementation: every read runs the computation, nothing is stored.
 * Used when caching is disabled.
 */
public class NoOpStageCache implements StageCache {

    @Override
    public <V> V getOrCompute(CacheAttribute<V> attribute, CompositeKey key, Supplier<V> computation) {
        V value = computation.get();
        if (value == null) {
            throw new IllegalStateException("Computation of " + attribute + " for " + key + " returned null");
        }
        return value;
    }

    @Override
    public <V> Optional<V> getIfPresent(CacheAttribute<V> attribute, CompositeKey key) {
        return Optional.empty();
    }

    @Override
    public int invalidate(Set<? extends CacheAttribute<?>> attributes) {
        return 0;
    }

    @Override
    public int invalidateEntity(String entityId) {
        return 0;
    }

    @Override
    public int invalidateAll(boolean includeProtected) {
        return 0;
    }

    @Override
    public void protect(Collection<? extends CacheAttribute<?>> attributes) {
        // no-op
    }

    @Override
    public boolean isProtected(CacheAttribute<?> attribute) {
        return false;
    }

    @Override
    public Set<CacheAttribute<?>> attributesWithData() {
        return Set.of();
    }

    @Override
    public Set<CompositeKey> keysFor(CacheAttribute<?> attribute) {
        return Set.of();
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
