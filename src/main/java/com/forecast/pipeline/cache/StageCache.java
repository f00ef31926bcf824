package com.forecast.pipeline.cache;

import com.forecast.pipeline.core.model.CompositeKey;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Memoization store shared by all stages of one pipeline.
 * Entries are addressed by {@code (attribute, key)} and can be cleared in bulk
 * by attribute. Protected attributes survive every invalidation except
 * {@link #invalidateAll(boolean)} with {@code includeProtected = true}.
 */
public interface StageCache {

    /**
     * Returns the value stored at {@code (attribute, key)}, computing and storing it
     * first if absent. The computation runs at most once per slot, concurrent callers
     * wait for it. A computation that throws or returns {@code null} stores nothing.
     *
     * @param attribute   the owning attribute
     * @param key         the composite key
     * @param computation the computation producing the value
     * @return the stored value
     */
    <V> V getOrCompute(CacheAttribute<V> attribute, CompositeKey key, Supplier<V> computation);

    /**
     * Returns the stored value without computing.
     */
    <V> Optional<V> getIfPresent(CacheAttribute<V> attribute, CompositeKey key);

    /**
     * Removes every entry under the given attributes, across all keys.
     * Protected and unknown attributes are skipped.
     *
     * @return number of entries removed
     */
    int invalidate(Set<? extends CacheAttribute<?>> attributes);

    /**
     * Removes every unprotected entry whose key starts with {@code entityId}.
     *
     * @return number of entries removed
     */
    int invalidateEntity(String entityId);

    /**
     * Removes all entries, including those of protected attributes if requested.
     *
     * @return number of entries removed
     */
    int invalidateAll(boolean includeProtected);

    /**
     * Marks attributes as exempt from invalidation.
     */
    void protect(Collection<? extends CacheAttribute<?>> attributes);

    boolean isProtected(CacheAttribute<?> attribute);

    /**
     * Returns the attributes currently holding at least one value.
     */
    Set<CacheAttribute<?>> attributesWithData();

    /**
     * Returns the keys holding a value under {@code attribute}.
     */
    Set<CompositeKey> keysFor(CacheAttribute<?> attribute);

    CacheStats getStats();
}
