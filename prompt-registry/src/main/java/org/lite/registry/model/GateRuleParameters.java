package org.lite.registry.model;

import org.lite.registry.enums.GateRuleKind;

/**
 * Kind-specific rule parameters. Each permitted type is tagged with exactly one {@link GateRuleKind}.
 */
public sealed interface GateRuleParameters
        permits GateRuleParameters.MinimumScore,
                GateRuleParameters.DimensionFloor,
                GateRuleParameters.NoRegression,
                GateRuleParameters.BenchmarkFreshness {

    GateRuleKind kind();

    record MinimumScore(double threshold) implements GateRuleParameters {
        @Override
        public GateRuleKind kind() {
            return GateRuleKind.MINIMUM_SCORE;
        }
    }

    record DimensionFloor(String dimension, double threshold) implements GateRuleParameters {
        @Override
        public GateRuleKind kind() {
            return GateRuleKind.DIMENSION_FLOOR;
        }
    }

    record NoRegression(double tolerance) implements GateRuleParameters {
        @Override
        public GateRuleKind kind() {
            return GateRuleKind.NO_REGRESSION;
        }
    }

    record BenchmarkFreshness(long maxAgeHours) implements GateRuleParameters {
        @Override
        public GateRuleKind kind() {
            return GateRuleKind.BENCHMARK_FRESHNESS;
        }
    }
}
