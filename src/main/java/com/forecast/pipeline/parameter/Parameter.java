package com.forecast.pipeline.parameter;

import java.util.Objects;
import java.util.function.Function;

/**
 * Declaration of a tunable stage parameter: its name, value type and
 * configuration scope. Values coming from configuration or the default
 * table are converted to the declared type.
 */
public final class Parameter<T> {
    private final String name;
    private final Class<T> type;
    private final ParameterScope scope;
    private final Function<Object, T> converter;

    private Parameter(String name, Class<T> type, ParameterScope scope, Function<Object, T> converter) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.type = Objects.requireNonNull(type, "type is required");
        this.scope = Objects.requireNonNull(scope, "scope is required");
        this.converter = converter;
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
    }

    /**
     * A numeric parameter; any configured {@link Number} is accepted.
     */
    public static Parameter<Double> ofDouble(String name, ParameterScope scope) {
        return new Parameter<>(name, Double.class, scope, raw -> {
            if (raw instanceof Number n) {
                return n.doubleValue();
            }
            throw new InvalidParameterException(name, raw, Double.class);
        });
    }

    /**
     * A parameter whose configured values must already be instances of {@code type}.
     */
    public static <T> Parameter<T> of(String name, Class<T> type, ParameterScope scope) {
        return new Parameter<>(name, type, scope, raw -> {
            if (type.isInstance(raw)) {
                return type.cast(raw);
            }
            throw new InvalidParameterException(name, raw, type);
        });
    }

    public String getName() {
        return name;
    }

    public Class<T> getType() {
        return type;
    }

    public ParameterScope getScope() {
        return scope;
    }

    T convert(Object raw) {
        return converter.apply(raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Parameter<?> that = (Parameter<?>) o;
        return name.equals(that.name) && type.equals(that.type) && scope == that.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, scope);
    }

    @Override
    public String toString() {
        return "Parameter{" +
                "name='" + name + '\'' +
                ", type=" + type.getSimpleName() +
                ", scope=" + scope +
                '}';
    }
}
