package com.forecast.pipeline.parameter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecast.pipeline.core.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable process-wide default table.
 *
 * <p>{@link #standard()} loads {@value #RESOURCE} from the classpath once.</p>
 */
public final class SystemDefaults implements DefaultTable {
    private static final Logger log = LoggerFactory.getLogger(SystemDefaults.class);

    public static final String RESOURCE = "system-defaults.json";

    private static volatile SystemDefaults standard;

    private final Map<String, Object> values;

    private SystemDefaults(Map<String, Object> values) {
        this.values = Map.copyOf(values);
    }

    /**
     * The defaults shipped with the library.
     */
    public static SystemDefaults standard() {
        SystemDefaults result = standard;
        if (result == null) {
            synchronized (SystemDefaults.class) {
                result = standard;
                if (result == null) {
                    try (InputStream input = SystemDefaults.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                        if (input == null) {
                            throw new PipelineException("Default table resource not found: " + RESOURCE);
                        }
                        result = load(input);
                    } catch (IOException e) {
                        throw new PipelineException("Failed to read default table " + RESOURCE, e);
                    }
                    log.info("Loaded {} system defaults from {}", result.values.size(), RESOURCE);
                    standard = result;
                }
            }
        }
        return result;
    }

    /**
     * Reads a flat JSON object of name to value.
     */
    public static SystemDefaults load(InputStream input) {
        try {
            Map<String, Object> values = new ObjectMapper().readValue(input, new TypeReference<Map<String, Object>>() {});
            Map<String, Object> nonNull = new LinkedHashMap<>();
            values.forEach((name, value) -> {
                if (value != null) {
                    nonNull.put(name, value);
                }
            });
            return new SystemDefaults(nonNull);
        } catch (IOException e) {
            throw new PipelineException("Failed to parse default table", e);
        }
    }

    public static SystemDefaults of(Map<String, ?> values) {
        return new SystemDefaults(Map.copyOf(values));
    }

    @Override
    public Optional<Object> lookup(String parameterName) {
        return Optional.ofNullable(values.get(parameterName));
    }

    public boolean contains(String parameterName) {
        return values.containsKey(parameterName);
    }

    /**
     * Returns a copy with {@code name} set to {@code value}.
     */
    public SystemDefaults with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(Objects.requireNonNull(name, "name is required"), Objects.requireNonNull(value, "value is required"));
        return new SystemDefaults(copy);
    }

    @Override
    public String toString() {
        return "SystemDefaults" + values;
    }
}
