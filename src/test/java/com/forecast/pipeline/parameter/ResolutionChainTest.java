package com.forecast.pipeline.parameter;

import com.forecast.pipeline.config.PipelineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ResolutionChain Tests")
@ExtendWith(MockitoExtension.class)
class ResolutionChainTest {

    private static final Parameter<Double> SCALAR = Parameter.ofDouble("forecast_scalar", ParameterScope.PER_VARIANT);
    private static final Parameter<Double> CAP = Parameter.ofDouble("forecast_cap", ParameterScope.GLOBAL);

    private static final SystemDefaults DEFAULTS = SystemDefaults.of(Map.of(
            "forecast_scalar", 1.0,
            "forecast_cap", 20.0));

    private static final PipelineConfig CONFIG = PipelineConfig.builder()
            .variant("ewmac8", "forecast_scalar", 5.3)
            .parameter("forecast_cap", 21.0)
            .build();

    private static ResolutionChain chain(ParameterOverrides overrides, PipelineConfig config) {
        return new ResolutionChain(overrides, config, DEFAULTS);
    }

    @Nested
    @DisplayName("Tier precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("Override wins over configuration")
        void testOverridePrecedence() {
            ParameterOverrides overrides = ParameterOverrides.builder()
                    .put(SCALAR, ParameterOverride.perVariant(Map.of("ewmac8", 10.0)))
                    .put(CAP, ParameterOverride.forAllVariants(2.0))
                    .build();
            ResolutionChain chain = chain(overrides, CONFIG);

            ResolvedParameter<Double> scalar = chain.resolveWithSource(SCALAR, "EDOLLAR", "ewmac8");
            assertEquals(10.0, scalar.value());
            assertEquals(ParameterTier.OVERRIDE, scalar.tier());
            assertEquals(2.0, chain.resolve(CAP, "EDOLLAR", "ewmac8"));
        }

        @Test
        @DisplayName("Configuration wins over defaults")
        void testConfigurationPrecedence() {
            ResolutionChain chain = chain(ParameterOverrides.none(), CONFIG);

            ResolvedParameter<Double> scalar = chain.resolveWithSource(SCALAR, "EDOLLAR", "ewmac8");
            assertEquals(5.3, scalar.value());
            assertEquals(ParameterTier.CONFIGURATION, scalar.tier());
            assertEquals(21.0, chain.resolve(CAP, "EDOLLAR", "ewmac8"));
        }

        @Test
        @DisplayName("Defaults apply when neither override nor configuration has the value")
        void testDefaultFallback() {
            ResolutionChain chain = chain(ParameterOverrides.none(), PipelineConfig.empty());

            ResolvedParameter<Double> scalar = chain.resolveWithSource(SCALAR, "EDOLLAR", "ewmac8");
            assertEquals(1.0, scalar.value());
            assertEquals(ParameterTier.DEFAULT, scalar.tier());
            assertEquals(20.0, chain.resolve(CAP, "EDOLLAR", "ewmac8"));
        }

        @Test
        @DisplayName("Per-variant override defers for variants it does not list")
        void testPerVariantPresence() {
            ParameterOverrides overrides = ParameterOverrides.builder()
                    .put(SCALAR, ParameterOverride.perVariant(Map.of("ewmac32", 3.0)))
                    .build();
            ResolutionChain chain = chain(overrides, CONFIG);

            assertEquals(3.0, chain.resolve(SCALAR, "EDOLLAR", "ewmac32"));
            assertEquals(5.3, chain.resolve(SCALAR, "EDOLLAR", "ewmac8"));
        }

        @Test
        @DisplayName("Empty override map counts as absent")
        void testEmptyOverrideFallsThrough() {
            ParameterOverrides overrides = ParameterOverrides.builder()
                    .put(SCALAR, ParameterOverride.perVariant(Map.of()))
                    .put(CAP, ParameterOverride.forAllVariants(null))
                    .build();
            ResolutionChain chain = chain(overrides, CONFIG);

            assertEquals(ParameterTier.CONFIGURATION, chain.resolveWithSource(SCALAR, "EDOLLAR", "ewmac8").tier());
            assertEquals(ParameterTier.CONFIGURATION, chain.resolveWithSource(CAP, "EDOLLAR", "ewmac8").tier());
        }

        @Test
        @DisplayName("Global parameters ignore per-variant configuration")
        void testScopes() {
            PipelineConfig config = PipelineConfig.builder()
                    .variant("ewmac8", "forecast_cap", 4.0)
                    .parameter("forecast_scalar", 9.0)
                    .build();
            ResolutionChain chain = chain(ParameterOverrides.none(), config);

            assertEquals(20.0, chain.resolve(CAP, "EDOLLAR", "ewmac8"));
            assertEquals(1.0, chain.resolve(SCALAR, "EDOLLAR", "ewmac8"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Missing default should fail loudly")
        void testDefaultMissing() {
            Parameter<Double> unknown = Parameter.ofDouble("vol_target", ParameterScope.GLOBAL);
            ResolutionChain chain = chain(ParameterOverrides.none(), PipelineConfig.empty());

            DefaultMissingException e = assertThrows(DefaultMissingException.class,
                    () -> chain.resolve(unknown, "EDOLLAR", "ewmac8"));
            assertEquals(List.of("vol_target"), e.getParameterNames());
        }

        @Test
        @DisplayName("Non-numeric configured value should be rejected")
        void testInvalidValue() {
            PipelineConfig config = PipelineConfig.builder()
                    .variant("ewmac8", "forecast_scalar", "five")
                    .build();
            ResolutionChain chain = chain(ParameterOverrides.none(), config);

            assertThrows(InvalidParameterException.class, () -> chain.resolve(SCALAR, "EDOLLAR", "ewmac8"));
        }

        @Test
        @DisplayName("Integer configured values convert to double")
        void testIntegerConversion() {
            PipelineConfig config = PipelineConfig.builder().parameter("forecast_cap", 15).build();

            assertEquals(15.0, chain(ParameterOverrides.none(), config).resolve(CAP, "EDOLLAR", "ewmac8"));
        }
    }

    @Nested
    @DisplayName("Default table interaction")
    class DefaultTableTests {

        @Mock
        private DefaultTable defaults;

        @Test
        @DisplayName("Default table is only consulted when the upper tiers are absent")
        void testDefaultsConsultedLast() {
            when(defaults.lookup("forecast_scalar")).thenReturn(Optional.of(1.0));
            ResolutionChain chain = new ResolutionChain(ParameterOverrides.none(), CONFIG, defaults);

            chain.resolve(SCALAR, "EDOLLAR", "ewmac8");
            verifyNoInteractions(defaults);

            assertEquals(1.0, chain.resolve(SCALAR, "EDOLLAR", "ewmac16"));
            verify(defaults).lookup("forecast_scalar");
        }

        @Test
        @DisplayName("Identical inputs resolve identically")
        void testDeterministic() {
            when(defaults.lookup("forecast_cap")).thenReturn(Optional.of(20.0));
            ResolutionChain chain = new ResolutionChain(ParameterOverrides.none(), PipelineConfig.empty(), defaults);

            assertEquals(chain.resolve(CAP, "EDOLLAR", "ewmac8"), chain.resolve(CAP, "EDOLLAR", "ewmac8"));
        }
    }
}
