package com.forecast.pipeline.parameter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Terminal tier of parameter resolution: a flat name to value table.
 * Every parameter ever resolved through it must have an entry.
 */
@FunctionalInterface
public interface DefaultTable {

    Optional<Object> lookup(String parameterName);

    /**
     * Checks that every parameter has a default. Pipelines call this at assembly
     * so an incomplete table is reported up front rather than on first use.
     *
     * @throws DefaultMissingException listing, sorted, every parameter without one
     */
    default void validate(Collection<? extends Parameter<?>> parameters) {
        List<String> missing = parameters.stream()
                .map(Parameter::getName)
                .filter(name -> lookup(name).isEmpty())
                .distinct()
                .sorted()
                .toList();
        if (!missing.isEmpty()) {
            throw new DefaultMissingException(missing);
        }
    }
}
