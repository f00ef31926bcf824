package com.forecast.pipeline.cache;

import java.util.Objects;

/**
 * Typed name of a cache-bearing stage attribute, e.g. {@code scaled_forecast}.
 * Values stored under an attribute are always of its declared type.
 *
 * @param name the attribute name, unique within a pipeline
 * @param type the type of the values stored under this attribute
 * @param <V>  value type
 */
public record CacheAttribute<V>(String name, Class<V> type) {

    public CacheAttribute {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Attribute name must not be blank");
        }
    }

    public static <V> CacheAttribute<V> of(String name, Class<V> type) {
        return new CacheAttribute<>(name, type);
    }

    V cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
