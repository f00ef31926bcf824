package com.forecast.pipeline.stage;

import com.forecast.pipeline.api.Pipeline;
import com.forecast.pipeline.cache.CacheAttribute;
import com.forecast.pipeline.core.model.CompositeKey;
import com.forecast.pipeline.core.model.LabeledSeries;
import com.forecast.pipeline.logging.LogContext;
import com.forecast.pipeline.parameter.Parameter;
import com.forecast.pipeline.parameter.ResolutionChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Base class of a pipeline stage.
 *
 * <p>A stage owns the logic producing its outputs but not their storage: every
 * value goes through the cache of the {@link Pipeline} the stage is registered on.
 * Subclasses register their named outputs with {@link #defineOutput} in the
 * constructor and build each one from {@link #upstream} outputs, parameters from
 * {@link #resolveParameter} and a pure transform, wrapped in {@link #cached}.</p>
 *
 * <pre>
 * public LabeledSeries getScaledForecast(String instrument, String rule) {
 *     return cached(SCALED_FORECAST, instrument, rule, () -&gt; {
 *         LabeledSeries raw = getRawForecast(instrument, rule);
 *         double scalar = getForecastScalar(instrument, rule);
 *         return checkShape(SCALED_FORECAST, raw, raw.map(v -&gt; v * scalar));
 *     });
 * }
 * </pre>
 */
public abstract class PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(PipelineStage.class);

    private final StageDeclaration declaration;
    private final Map<CacheAttribute<LabeledSeries>, OutputComputation> outputs = new LinkedHashMap<>();
    private volatile Pipeline parent;
    private volatile ResolutionChain resolutionChain;

    protected PipelineStage(StageDeclaration declaration) {
        this.declaration = Objects.requireNonNull(declaration, "declaration is required");
    }

    public String getName() {
        return declaration.name();
    }

    public StageDeclaration getDeclaration() {
        return declaration;
    }

    /**
     * Binds this stage to its pipeline. Called once by the pipeline during assembly.
     *
     * @throws IllegalStateException if the stage already belongs to another pipeline
     */
    public final synchronized void attachTo(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "pipeline is required");
        if (parent != null && parent != pipeline) {
            throw new IllegalStateException("Stage '" + getName() + "' is already registered on another pipeline");
        }
        this.resolutionChain = new ResolutionChain(declaration.overrides(), pipeline.getConfig(), pipeline.getDefaults());
        this.parent = pipeline;
    }

    protected final Pipeline parent() {
        Pipeline pipeline = parent;
        if (pipeline == null) {
            throw new IllegalStateException("Stage '" + getName() + "' is not registered on a pipeline");
        }
        return pipeline;
    }

    public boolean isAttached() {
        return parent != null;
    }

    // ========== Outputs ==========

    /**
     * Returns the named output for an {@code (entity, variant)} pair.
     *
     * @throws IllegalArgumentException    if this stage has no such output
     * @throws MissingDependencyException  if a required upstream stage is not registered
     */
    public final LabeledSeries getOutput(CacheAttribute<LabeledSeries> output, String entityId, String variantId) {
        OutputComputation computation = outputs.get(output);
        if (computation == null) {
            throw new IllegalArgumentException("Stage '" + getName() + "' has no output '" + output + "'");
        }
        return computation.compute(entityId, variantId);
    }

    public Set<CacheAttribute<LabeledSeries>> getOutputNames() {
        return Collections.unmodifiableSet(outputs.keySet());
    }

    protected final void defineOutput(CacheAttribute<LabeledSeries> output, OutputComputation computation) {
        if (outputs.putIfAbsent(output, computation) != null) {
            throw new IllegalArgumentException("Stage '" + getName() + "' defines output '" + output + "' twice");
        }
    }

    // ========== Building blocks for subclasses ==========

    /**
     * Reads another stage of the same pipeline. The stage must be registered
     * before this one.
     */
    protected final PipelineStage upstream(String stageName) {
        return parent().upstreamOf(this, stageName);
    }

    protected final <S extends PipelineStage> S upstream(String stageName, Class<S> type) {
        PipelineStage stage = upstream(stageName);
        if (!type.isInstance(stage)) {
            throw new MissingDependencyException(stageName, "Stage '" + getName() + "' requires '" + stageName
                    + "' to be a " + type.getSimpleName() + " but found " + stage.getClass().getSimpleName());
        }
        return type.cast(stage);
    }

    protected final <T> T resolveParameter(Parameter<T> parameter, String entityId, String variantId) {
        parent();
        return resolutionChain.resolve(parameter, entityId, variantId);
    }

    /**
     * Memoizes {@code computation} under {@code (attribute, (entityId, variantId))}
     * in the pipeline cache.
     */
    protected final <V> V cached(CacheAttribute<V> attribute, String entityId, String variantId,
                                 Supplier<V> computation) {
        CompositeKey key = CompositeKey.of(entityId, variantId);
        Pipeline pipeline = parent();
        return pipeline.getCache().getOrCompute(attribute, key, () -> observe(pipeline, attribute, key, computation));
    }

    private <V> V observe(Pipeline pipeline, CacheAttribute<V> attribute, CompositeKey key, Supplier<V> computation) {
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forStage(getName(), attribute.name(), key)) {
            V value = computation.get();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            pipeline.getMetrics().recordComputeDuration(getName(), attribute, elapsed);
            log.debug("stage.computed stage={} attribute={} key={} durationMs={}",
                    getName(), attribute, key, elapsed.toMillis());
            return value;
        } catch (RuntimeException e) {
            pipeline.getMetrics().recordComputeFailure(getName(), attribute);
            log.warn("stage.failed stage={} attribute={} key={} error={}",
                    getName(), attribute, key, e.getMessage());
            throw e;
        }
    }

    /**
     * Returns {@code output} if it has the same name, length and index as {@code input}.
     *
     * @throws ShapeMismatchException otherwise
     */
    protected final LabeledSeries checkShape(CacheAttribute<LabeledSeries> output, LabeledSeries input,
                                             LabeledSeries result) {
        if (input == null || !input.hasSameShapeAs(result)) {
            throw new ShapeMismatchException(getName(), output.name(), input, result);
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " stage '" + getName() + "'";
    }
}
