package com.forecast.pipeline.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered tuple of identifiers addressing one computed value
 * within a stage's output space, e.g. {@code (instrument code, rule variation)}.
 *
 * @param parts the key parts, in order
 */
public record CompositeKey(List<String> parts) {

    public CompositeKey {
        Objects.requireNonNull(parts, "parts is required");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("CompositeKey needs at least one part");
        }
        for (String part : parts) {
            if (part == null) {
                throw new IllegalArgumentException("CompositeKey parts must not be null");
            }
        }
        parts = List.copyOf(parts);
    }

    public static CompositeKey of(String... parts) {
        return new CompositeKey(List.of(parts));
    }

    /**
     * Key for an {@code (entity, variant)} pair.
     */
    public static CompositeKey of(String entityId, String variantId) {
        return new CompositeKey(List.of(entityId, variantId));
    }

    /**
     * The leading part, by convention the entity (instrument) identifier.
     */
    public String entityId() {
        return parts.get(0);
    }

    public int size() {
        return parts.size();
    }

    public String part(int index) {
        return parts.get(index);
    }

    @Override
    public String toString() {
        return String.join("/", parts);
    }
}
