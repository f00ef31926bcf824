package com.forecast.pipeline.api;

import com.forecast.pipeline.cache.CacheAttribute;
import com.forecast.pipeline.cache.CacheConfig;
import com.forecast.pipeline.cache.CacheStats;
import com.forecast.pipeline.cache.CaffeineStageCache;
import com.forecast.pipeline.cache.NoOpStageCache;
import com.forecast.pipeline.cache.StageCache;
import com.forecast.pipeline.config.PipelineConfig;
import com.forecast.pipeline.logging.LogContext;
import com.forecast.pipeline.metrics.NoOpPipelineMetrics;
import com.forecast.pipeline.metrics.PipelineMetrics;
import com.forecast.pipeline.parameter.DefaultTable;
import com.forecast.pipeline.parameter.Parameter;
import com.forecast.pipeline.parameter.SystemDefaults;
import com.forecast.pipeline.stage.MissingDependencyException;
import com.forecast.pipeline.stage.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A forecast pipeline: the shared configuration, the default table, the ordered
 * set of named stages and the single cache all of them memoize into.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * Pipeline pipeline = Pipeline.builder()
 *     .config(new JsonConfigLoader().load(path))
 *     .stage(new RawForecastStage(source))
 *     .stage(new ForecastScaleCapStage())
 *     .build();
 *
 * LabeledSeries capped = pipeline.stage(ForecastScaleCapStage.NAME, ForecastScaleCapStage.class)
 *     .getCappedForecast("EDOLLAR", "ewmac8");
 *
 * // after changing something upstream
 * pipeline.recalculate();
 * </pre>
 *
 * <p>Stages may only read stages registered before them, which keeps the read
 * graph acyclic.</p>
 */
public class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineConfig config;
    private final DefaultTable defaults;
    private final StageCache cache;
    private final PipelineMetrics metrics;
    private final Map<String, PipelineStage> stages;
    private final Map<String, Integer> positions;

    private Pipeline(Builder builder) {
        this.config = builder.config;
        this.defaults = builder.defaults != null ? builder.defaults : SystemDefaults.standard();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpPipelineMetrics();
        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig.enabled()) {
            this.cache = new CaffeineStageCache(builder.cacheConfig, metrics);
        } else {
            this.cache = new NoOpStageCache();
        }

        Map<String, PipelineStage> registered = new LinkedHashMap<>();
        Map<String, Integer> order = new LinkedHashMap<>();
        for (PipelineStage stage : builder.stages) {
            if (registered.putIfAbsent(stage.getName(), stage) != null) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.getName());
            }
            order.put(stage.getName(), order.size());
        }
        this.stages = Collections.unmodifiableMap(registered);
        this.positions = Map.copyOf(order);

        if (builder.validateDefaults) {
            validateDefaults();
        }
        for (PipelineStage stage : stages.values()) {
            if (stage.isAttached()) {
                throw new IllegalStateException("Stage '" + stage.getName() + "' is already registered on another pipeline");
            }
        }
        for (PipelineStage stage : stages.values()) {
            stage.attachTo(this);
            cache.protect(stage.getDeclaration().protectedAttributes());
        }

        log.info("Pipeline assembled with stages {} and configuration {}", stages.keySet(), config);
    }

    private void validateDefaults() {
        Set<Parameter<?>> declared = new LinkedHashSet<>();
        for (PipelineStage stage : stages.values()) {
            declared.addAll(stage.getDeclaration().parameters());
        }
        defaults.validate(declared);
    }

    // ========== Stages ==========

    /**
     * Returns the stage registered under {@code name}.
     *
     * @throws MissingDependencyException if there is none
     */
    public PipelineStage stage(String name) {
        PipelineStage stage = stages.get(name);
        if (stage == null) {
            throw new MissingDependencyException(name, "No stage '" + name + "' in pipeline " + stages.keySet());
        }
        return stage;
    }

    public <S extends PipelineStage> S stage(String name, Class<S> type) {
        PipelineStage stage = stage(name);
        if (!type.isInstance(stage)) {
            throw new IllegalArgumentException("Stage '" + name + "' is a " + stage.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(stage);
    }

    public boolean hasStage(String name) {
        return stages.containsKey(name);
    }

    /**
     * Stage names in registration order.
     */
    public Set<String> stageNames() {
        return stages.keySet();
    }

    /**
     * Resolves the upstream stage {@code name} on behalf of {@code requester}.
     *
     * @throws MissingDependencyException if {@code name} is not registered, or is
     *                                    registered after {@code requester}
     */
    public PipelineStage upstreamOf(PipelineStage requester, String name) {
        PipelineStage target = stages.get(name);
        if (target == null) {
            throw new MissingDependencyException(name, "Stage '" + requester.getName()
                    + "' requires upstream stage '" + name + "', which is not registered");
        }
        Integer requesterPosition = positions.get(requester.getName());
        if (requesterPosition != null && positions.get(name) >= requesterPosition) {
            throw new MissingDependencyException(name, "Stage '" + requester.getName()
                    + "' requires upstream stage '" + name + "', which must be registered before it");
        }
        return target;
    }

    // ========== Cache management ==========

    /**
     * Clears every entry under the given attributes. Callers pass the full cascade;
     * protected attributes are kept.
     *
     * @return number of entries removed
     */
    public int invalidate(Set<? extends CacheAttribute<?>> attributes) {
        try (LogContext ctx = LogContext.forInvalidation("attributes")) {
            int removed = cache.invalidate(attributes);
            log.info("cache.invalidated attributes={} removed={}", attributes, removed);
            return removed;
        }
    }

    public int invalidate(CacheAttribute<?>... attributes) {
        return invalidate(new LinkedHashSet<>(Arrays.asList(attributes)));
    }

    /**
     * Clears, for every stage, the attributes it declared as invalidated on recalculation.
     *
     * @return number of entries removed
     */
    public int recalculate() {
        Set<CacheAttribute<?>> attributes = new LinkedHashSet<>();
        for (PipelineStage stage : stages.values()) {
            attributes.addAll(stage.getDeclaration().invalidateOnRecalc());
        }
        try (LogContext ctx = LogContext.forInvalidation("recalculate")) {
            int removed = cache.invalidate(attributes);
            log.info("pipeline.recalculate removed={}", removed);
            return removed;
        }
    }

    /**
     * Clears every unprotected entry of one instrument.
     */
    public int invalidateEntity(String entityId) {
        try (LogContext ctx = LogContext.forInvalidation("entity").with("entityId", entityId)) {
            int removed = cache.invalidateEntity(entityId);
            log.info("cache.invalidated entityId={} removed={}", entityId, removed);
            return removed;
        }
    }

    /**
     * Clears the whole cache, protected attributes included only if requested.
     */
    public int clearCache(boolean includeProtected) {
        try (LogContext ctx = LogContext.forInvalidation("all")) {
            int removed = cache.invalidateAll(includeProtected);
            log.info("cache.cleared includeProtected={} removed={}", includeProtected, removed);
            return removed;
        }
    }

    public Set<CacheAttribute<?>> attributesWithData() {
        return cache.attributesWithData();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    // ========== Accessors ==========

    public PipelineConfig getConfig() {
        return config;
    }

    public DefaultTable getDefaults() {
        return defaults;
    }

    public StageCache getCache() {
        return cache;
    }

    public PipelineMetrics getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "Pipeline" + stages.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PipelineConfig config = PipelineConfig.empty();
        private DefaultTable defaults;
        private StageCache cache;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private PipelineMetrics metrics;
        private final List<PipelineStage> stages = new ArrayList<>();
        private boolean validateDefaults = true;

        public Builder config(PipelineConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        /**
         * Sets the default table. Defaults to {@link SystemDefaults#standard()}.
         */
        public Builder defaults(DefaultTable defaults) {
            this.defaults = defaults;
            return this;
        }

        /**
         * Uses the given cache instead of one built from {@link #cacheConfig}.
         */
        public Builder cache(StageCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Registers a stage. Stages may only read stages registered before them.
         */
        public Builder stage(PipelineStage stage) {
            stages.add(Objects.requireNonNull(stage, "stage is required"));
            return this;
        }

        public Builder stages(PipelineStage... stages) {
            for (PipelineStage stage : stages) {
                stage(stage);
            }
            return this;
        }

        /**
         * Whether {@link #build()} checks that the default table covers every
         * parameter the stages declare. On by default.
         */
        public Builder validateDefaults(boolean validateDefaults) {
            this.validateDefaults = validateDefaults;
            return this;
        }

        public Pipeline build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("A pipeline needs at least one stage");
            }
            return new Pipeline(this);
        }
    }
}
