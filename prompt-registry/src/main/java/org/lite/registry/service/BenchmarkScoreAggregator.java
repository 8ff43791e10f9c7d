package org.lite.registry.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.registry.dto.ScoreAggregate;
import org.lite.registry.exception.InvalidScoreException;
import org.lite.registry.exception.NoScoresException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Folds per-dimension benchmark scores into an overall score, a baseline delta and the aggregator-level gate.
 */
@Service
@Slf4j
public class BenchmarkScoreAggregator {

    private static final double MIN_SCORE = 0.0;
    private static final double MAX_SCORE = 100.0;
    private static final double DEFAULT_WEIGHT = 1.0;

    public ScoreAggregate aggregate(Map<String, Double> dimensionScores, Double baselineScore, double gateThreshold) {
        return aggregate(dimensionScores, baselineScore, gateThreshold, null);
    }

    /**
     * @param weights optional per-dimension weights; dimensions missing from the map weigh {@value #DEFAULT_WEIGHT}
     */
    public ScoreAggregate aggregate(Map<String, Double> dimensionScores, Double baselineScore,
                                    double gateThreshold, Map<String, Double> weights) {
        if (dimensionScores == null || dimensionScores.isEmpty()) {
            throw new NoScoresException("Cannot aggregate a benchmark run without dimension scores");
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        for (Map.Entry<String, Double> entry : dimensionScores.entrySet()) {
            double score = validScore(entry.getKey(), entry.getValue());
            double weight = weightFor(entry.getKey(), weights);
            weightedSum += score * weight;
            totalWeight += weight;
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        if (totalWeight <= 0.0) {
            throw new InvalidScoreException("Dimension weights must not all be zero");
        }

        // Rounding can step just outside the observed range, e.g. every score at 80.04
        double overall = Math.max(min, Math.min(max, round(weightedSum / totalWeight)));
        Double delta = baselineScore != null ? round(overall - baselineScore) : null;
        boolean gatePassed = overall >= gateThreshold;

        log.debug("Aggregated {} dimensions to {} (delta {}, threshold {}, passed {})",
                dimensionScores.size(), overall, delta, gateThreshold, gatePassed);

        return ScoreAggregate.builder()
                .overallScore(overall)
                .delta(delta)
                .gateThreshold(gateThreshold)
                .gatePassed(gatePassed)
                .build();
    }

    private static double validScore(String dimension, Double score) {
        if (score == null || score.isNaN() || score < MIN_SCORE || score > MAX_SCORE) {
            throw new InvalidScoreException(String.format(
                    "Score for dimension '%s' must be within [%.0f, %.0f], got %s", dimension, MIN_SCORE, MAX_SCORE, score));
        }
        return score;
    }

    private static double weightFor(String dimension, Map<String, Double> weights) {
        if (weights == null || !weights.containsKey(dimension)) {
            return DEFAULT_WEIGHT;
        }
        Double weight = weights.get(dimension);
        if (weight == null || weight.isNaN() || weight.isInfinite() || weight < 0) {
            throw new InvalidScoreException(String.format(
                    "Weight for dimension '%s' must be a non-negative number, got %s", dimension, weight));
        }
        return weight;
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
