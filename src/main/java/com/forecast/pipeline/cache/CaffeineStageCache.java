package com.forecast.pipeline.cache;

import com.forecast.pipeline.core.PipelineException;
import com.forecast.pipeline.core.model.CompositeKey;
import com.forecast.pipeline.metrics.NoOpPipelineMetrics;
import com.forecast.pipeline.metrics.PipelineMetrics;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Caffeine-backed stage cache holding one async store per attribute.
 *
 * <p>Each slot holds a {@link CompletableFuture}: the first caller for an empty slot
 * installs an incomplete future and runs the computation on its own thread, outside
 * any map lock, so a computation may read other slots of the same attribute.
 * Later callers wait on that future. A failed computation removes its future.</p>
 *
 * <p>Invalidating an attribute swaps in a fresh store (a new generation). Computations
 * in flight against the old generation finish there and are never visible in the new
 * one, so a reader sees either the old or the new state of a slot.</p>
 *
 * <p>A batch invalidation holds the write side of {@code generationLock} for the whole
 * batch, while readers hold the read side only to find their slot and install a
 * future. No slot can therefore be claimed halfway through a batch, when some
 * attributes of a cascade are already cleared and their upstream ones are not.</p>
 */
public class CaffeineStageCache implements StageCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineStageCache.class);

    private final CacheConfig config;
    private final PipelineMetrics metrics;
    private final ConcurrentMap<CacheAttribute<?>, Generation> generations = new ConcurrentHashMap<>();
    private final Set<CacheAttribute<?>> protectedAttributes = ConcurrentHashMap.newKeySet();
    private final ReadWriteLock generationLock = new ReentrantReadWriteLock();
    // Slots the current thread is computing; used to fail fast on self-recursion
    private final ThreadLocal<Set<Slot>> computing = ThreadLocal.withInitial(HashSet::new);

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder invalidated = new LongAdder();

    public CaffeineStageCache() {
        this(CacheConfig.defaults(), new NoOpPipelineMetrics());
    }

    public CaffeineStageCache(CacheConfig config) {
        this(config, new NoOpPipelineMetrics());
    }

    public CaffeineStageCache(CacheConfig config, PipelineMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        log.info("CaffeineStageCache initialized: maxSizePerAttribute={}",
                config.isBounded() ? config.maxSizePerAttribute() : "unbounded");
    }

    @Override
    public <V> V getOrCompute(CacheAttribute<V> attribute, CompositeKey key, Supplier<V> computation) {
        AsyncCache<CompositeKey, Object> store;
        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing;
        generationLock.readLock().lock();
        try {
            store = generations.computeIfAbsent(attribute, a -> new Generation(newStore())).store;
            existing = store.getIfPresent(key);
            if (existing == null) {
                existing = store.asMap().putIfAbsent(key, created);
            }
        } finally {
            generationLock.readLock().unlock();
        }

        if (existing == null) {
            misses.increment();
            metrics.recordCacheMiss(attribute);
            return compute(store, attribute, key, created, computation);
        }

        Slot slot = new Slot(attribute, key);
        if (!existing.isDone() && computing.get().contains(slot)) {
            throw new IllegalStateException("Recursive computation of " + attribute + " for " + key);
        }
        Object value = await(existing);
        hits.increment();
        metrics.recordCacheHit(attribute);
        return attribute.cast(value);
    }

    private <V> V compute(AsyncCache<CompositeKey, Object> store, CacheAttribute<V> attribute, CompositeKey key,
                          CompletableFuture<Object> created, Supplier<V> computation) {
        Slot slot = new Slot(attribute, key);
        computing.get().add(slot);
        try {
            V value = computation.get();
            if (value == null) {
                throw new IllegalStateException("Computation of " + attribute + " for " + key + " returned null");
            }
            created.complete(value);
            log.debug("Cached {} for {}", attribute, key);
            return value;
        } catch (RuntimeException | Error e) {
            store.asMap().remove(key, created);
            created.completeExceptionally(e);
            throw e;
        } finally {
            computing.get().remove(slot);
        }
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new PipelineException("Cached computation failed", cause);
        }
    }

    @Override
    public <V> Optional<V> getIfPresent(CacheAttribute<V> attribute, CompositeKey key) {
        Generation generation = generations.get(attribute);
        if (generation == null) {
            return Optional.empty();
        }
        CompletableFuture<Object> future = generation.store.getIfPresent(key);
        if (!isValue(future)) {
            return Optional.empty();
        }
        return Optional.of(attribute.cast(future.join()));
    }

    @Override
    public int invalidate(Set<? extends CacheAttribute<?>> attributes) {
        int removed = 0;
        generationLock.writeLock().lock();
        try {
            for (CacheAttribute<?> attribute : attributes) {
                if (protectedAttributes.contains(attribute)) {
                    log.debug("Skipping invalidation of protected attribute {}", attribute);
                    continue;
                }
                removed += reset(attribute);
            }
        } finally {
            generationLock.writeLock().unlock();
        }
        log.debug("Invalidated {} cache entries for attributes {}", removed, attributes);
        return removed;
    }

    @Override
    public int invalidateEntity(String entityId) {
        int removed = 0;
        generationLock.writeLock().lock();
        try {
            for (Map.Entry<CacheAttribute<?>, Generation> entry : generations.entrySet()) {
                if (protectedAttributes.contains(entry.getKey())) {
                    continue;
                }
                ConcurrentMap<CompositeKey, CompletableFuture<Object>> map = entry.getValue().store.asMap();
                int count = 0;
                for (CompositeKey key : Set.copyOf(map.keySet())) {
                    if (key.entityId().equals(entityId) && isValue(map.remove(key))) {
                        count++;
                    }
                }
                if (count > 0) {
                    invalidated.add(count);
                    metrics.recordInvalidation(entry.getKey(), count);
                    removed += count;
                }
            }
        } finally {
            generationLock.writeLock().unlock();
        }
        log.debug("Invalidated {} cache entries for entity {}", removed, entityId);
        return removed;
    }

    @Override
    public int invalidateAll(boolean includeProtected) {
        int removed = 0;
        generationLock.writeLock().lock();
        try {
            for (CacheAttribute<?> attribute : Set.copyOf(generations.keySet())) {
                if (!includeProtected && protectedAttributes.contains(attribute)) {
                    continue;
                }
                removed += reset(attribute);
            }
        } finally {
            generationLock.writeLock().unlock();
        }
        log.debug("Invalidated all {} cache entries (includeProtected={})", removed, includeProtected);
        return removed;
    }

    // Caller holds the write side of generationLock
    private int reset(CacheAttribute<?> attribute) {
        Generation generation = generations.get(attribute);
        if (generation == null) {
            return 0;
        }
        AsyncCache<CompositeKey, Object> previous = generation.store;
        generation.store = newStore();
        int count = countValues(previous);
        invalidated.add(count);
        metrics.recordInvalidation(attribute, count);
        return count;
    }

    @Override
    public void protect(Collection<? extends CacheAttribute<?>> attributes) {
        protectedAttributes.addAll(attributes);
    }

    @Override
    public boolean isProtected(CacheAttribute<?> attribute) {
        return protectedAttributes.contains(attribute);
    }

    @Override
    public Set<CacheAttribute<?>> attributesWithData() {
        return generations.entrySet().stream()
                .filter(e -> e.getValue().store.asMap().values().stream().anyMatch(CaffeineStageCache::isValue))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Set<CompositeKey> keysFor(CacheAttribute<?> attribute) {
        Generation generation = generations.get(attribute);
        if (generation == null) {
            return Set.of();
        }
        return generation.store.asMap().entrySet().stream()
                .filter(e -> isValue(e.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public CacheStats getStats() {
        long size = generations.values().stream()
                .mapToLong(g -> countValues(g.store))
                .sum();
        return new CacheStats(hits.sum(), misses.sum(), invalidated.sum(), size);
    }

    private static int countValues(AsyncCache<CompositeKey, Object> store) {
        return (int) store.asMap().values().stream().filter(CaffeineStageCache::isValue).count();
    }

    private static boolean isValue(CompletableFuture<Object> future) {
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    private AsyncCache<CompositeKey, Object> newStore() {
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (config.isBounded()) {
            builder.maximumSize(config.maxSizePerAttribute());
        }
        return builder.buildAsync();
    }

    /**
     * Current store of one attribute; replaced wholesale on invalidation.
     */
    private static final class Generation {
        volatile AsyncCache<CompositeKey, Object> store;

        Generation(AsyncCache<CompositeKey, Object> store) {
            this.store = store;
        }
    }

    private record Slot(CacheAttribute<?> attribute, CompositeKey key) {}
}
