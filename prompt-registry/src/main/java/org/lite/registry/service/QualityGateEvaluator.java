package org.lite.registry.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.dto.GateEvaluation;
import org.lite.registry.dto.GateVerdict;
import org.lite.registry.entity.BenchmarkResult;
import org.lite.registry.enums.GateStatus;
import org.lite.registry.model.GateRuleParameters;
import org.lite.registry.model.QualityGateRule;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies an ordered list of quality gate rules to the latest benchmark result of a version.
 * <p>
 * Every rule yields exactly one evaluation, in configuration order. A rule whose condition holds is
 * {@code PASSED}; otherwise it is {@code FAILED} when blocking and {@code WARNING} when not. Deployment is
 * allowed iff no evaluation failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityGateEvaluator {

    private record Check(boolean holds, String message) {
    }

    private final Clock clock;

    /**
     * @param history benchmark results of the same prompt, newest first; may contain {@code latest} itself
     */
    public GateVerdict evaluate(List<QualityGateRule> rules, BenchmarkResult latest, List<BenchmarkResult> history) {
        if (latest == null) {
            throw new IllegalArgumentException("A benchmark result is required to evaluate quality gates");
        }
        List<QualityGateRule> configured = rules != null ? rules : List.of();
        List<BenchmarkResult> previous = history != null ? history : List.of();

        List<GateEvaluation> evaluations = new ArrayList<>(configured.size());
        for (QualityGateRule rule : configured) {
            evaluations.add(evaluateRule(rule, latest, previous));
        }

        List<String> blockers = messagesWithStatus(evaluations, GateStatus.FAILED);
        List<String> warnings = messagesWithStatus(evaluations, GateStatus.WARNING);
        boolean canDeploy = blockers.isEmpty();
        long passed = evaluations.stream().filter(e -> e.getStatus() == GateStatus.PASSED).count();

        String summary = String.format("Deployment %s: %d passed, %d failed, %d warning(s) across %d rule(s)",
                canDeploy ? "allowed" : "blocked", passed, blockers.size(), warnings.size(), evaluations.size());
        log.debug("Evaluated {} quality gate rules against benchmark {}: {}", evaluations.size(), latest.getId(), summary);

        return GateVerdict.builder()
                .canDeploy(canDeploy)
                .evaluations(List.copyOf(evaluations))
                .blockers(blockers)
                .warnings(warnings)
                .summary(summary)
                .evaluatedAt(clock.instant())
                .build();
    }

    private GateEvaluation evaluateRule(QualityGateRule rule, BenchmarkResult latest, List<BenchmarkResult> history) {
        GateRuleParameters parameters = rule.getParameters();
        Check check = switch (rule.getKind()) {
            case MINIMUM_SCORE -> checkMinimumScore((GateRuleParameters.MinimumScore) parameters, latest);
            case DIMENSION_FLOOR -> checkDimensionFloor((GateRuleParameters.DimensionFloor) parameters, latest);
            case NO_REGRESSION -> checkNoRegression((GateRuleParameters.NoRegression) parameters, latest, history);
            case BENCHMARK_FRESHNESS -> checkFreshness((GateRuleParameters.BenchmarkFreshness) parameters, latest);
        };

        GateStatus status;
        if (check.holds()) {
            status = GateStatus.PASSED;
        } else {
            status = rule.isBlocking() ? GateStatus.FAILED : GateStatus.WARNING;
        }

        return GateEvaluation.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .kind(rule.getKind())
                .status(status)
                .message(check.message())
                .blocking(rule.isBlocking())
                .build();
    }

    private Check checkMinimumScore(GateRuleParameters.MinimumScore parameters, BenchmarkResult latest) {
        double score = latest.getOverallScore();
        if (score >= parameters.threshold()) {
            return new Check(true, String.format("Overall score %s meets threshold %s",
                    format(score), format(parameters.threshold())));
        }
        return new Check(false, String.format("Overall score %s is below threshold %s",
                format(score), format(parameters.threshold())));
    }

    private Check checkDimensionFloor(GateRuleParameters.DimensionFloor parameters, BenchmarkResult latest) {
        Map<String, Double> scores = latest.getDimensionScores() != null ? latest.getDimensionScores() : Map.of();
        Double score = scores.get(parameters.dimension());
        if (score == null) {
            return new Check(false, String.format("Dimension '%s' is missing from the benchmark result (available: %s)",
                    parameters.dimension(), scores.isEmpty() ? "none" : String.join(", ", scores.keySet())));
        }
        if (score >= parameters.threshold()) {
            return new Check(true, String.format("Dimension '%s' score %s meets floor %s",
                    parameters.dimension(), format(score), format(parameters.threshold())));
        }
        return new Check(false, String.format("Dimension '%s' score %s is below floor %s",
                parameters.dimension(), format(score), format(parameters.threshold())));
    }

    private Check checkNoRegression(GateRuleParameters.NoRegression parameters, BenchmarkResult latest,
                                    List<BenchmarkResult> history) {
        Optional<BenchmarkResult> prior = findPrior(latest, history);
        if (prior.isEmpty()) {
            return new Check(true, "No prior benchmark result to compare against");
        }

        double current = latest.getOverallScore();
        double previous = prior.get().getOverallScore();
        if (current >= previous - parameters.tolerance()) {
            return new Check(true, String.format("Overall score %s is within tolerance %s of prior score %s",
                    format(current), format(parameters.tolerance()), format(previous)));
        }
        return new Check(false, String.format("Overall score %s regressed from prior score %s by %s (tolerance %s)",
                format(current), format(previous), format(BenchmarkScoreAggregator.round(previous - current)),
                format(parameters.tolerance())));
    }

    private Check checkFreshness(GateRuleParameters.BenchmarkFreshness parameters, BenchmarkResult latest) {
        if (latest.getExecutedAt() == null) {
            return new Check(false, "Benchmark result has no execution time");
        }
        Duration age = Duration.between(latest.getExecutedAt(), clock.instant());
        double ageHours = age.toMinutes() / 60.0;
        if (age.compareTo(Duration.ofHours(parameters.maxAgeHours())) <= 0) {
            return new Check(true, String.format(Locale.ROOT, "Benchmark is %.1f hours old (max %dh)",
                    ageHours, parameters.maxAgeHours()));
        }
        return new Check(false, String.format(Locale.ROOT, "Benchmark is stale: %.1f hours old (max %dh)",
                ageHours, parameters.maxAgeHours()));
    }

    /**
     * The result immediately preceding {@code latest} by execution time, never {@code latest} itself.
     */
    private static Optional<BenchmarkResult> findPrior(BenchmarkResult latest, List<BenchmarkResult> history) {
        Instant latestAt = latest.getExecutedAt();
        return history.stream()
                .filter(Objects::nonNull)
                .filter(result -> result != latest)
                .filter(result -> latest.getId() == null || !latest.getId().equals(result.getId()))
                .filter(result -> result.getExecutedAt() != null)
                .filter(result -> latestAt == null || !result.getExecutedAt().isAfter(latestAt))
                .max(Comparator.comparing(BenchmarkResult::getExecutedAt));
    }

    private static List<String> messagesWithStatus(List<GateEvaluation> evaluations, GateStatus status) {
        return evaluations.stream()
                .filter(evaluation -> evaluation.getStatus() == status)
                .map(GateEvaluation::getMessage)
                .toList();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
