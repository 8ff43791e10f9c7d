package org.lite.registry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.config.MongoReactiveConfig;
import org.lite.registry.config.RegistryProperties;
import org.lite.registry.dto.BenchmarkSubmission;
import org.lite.registry.dto.BenchmarkTrends;
import org.lite.registry.dto.ErrorCode;
import org.lite.registry.dto.RegressionAlert;
import org.lite.registry.dto.ScoreAggregate;
import org.lite.registry.dto.TrendPoint;
import org.lite.registry.entity.BenchmarkResult;
import org.lite.registry.entity.Prompt;
import org.lite.registry.enums.PromptStatus;
import org.lite.registry.exception.InvalidScoreException;
import org.lite.registry.exception.ResourceNotFoundException;
import org.lite.registry.repository.BenchmarkResultRepository;
import org.lite.registry.repository.PromptRepository;
import org.lite.registry.service.BenchmarkResultService;
import org.lite.registry.service.BenchmarkScoreAggregator;
import org.lite.registry.service.PromptVersionService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class BenchmarkResultServiceImpl implements BenchmarkResultService {

    private static final String DEFAULT_SUITE = "default";
    private static final String DEFAULT_ENVIRONMENT = "staging";

    // Trend analysis
    private static final Duration SHORT_WINDOW = Duration.ofDays(7);
    private static final Duration LONG_WINDOW = Duration.ofDays(30);
    private static final int SHORT_BASELINE_RUNS = 5;
    private static final int LONG_BASELINE_RUNS = 10;
    private static final int RECENT_RUNS = 3;
    private static final double REGRESSION_DROP_POINTS = 5.0;
    private static final int ALERT_TREND_DAYS = 30;
    private static final Set<PromptStatus> MONITORED_STATUSES = EnumSet.of(PromptStatus.STAGED, PromptStatus.DEPLOYED);

    private final BenchmarkResultRepository benchmarkResultRepository;
    private final PromptRepository promptRepository;
    private final PromptVersionService promptVersionService;
    private final BenchmarkScoreAggregator benchmarkScoreAggregator;
    private final RegistryProperties registryProperties;
    private final Clock clock;

    @Override
    public Mono<BenchmarkResult> recordResult(BenchmarkSubmission submission) {
        if (submission == null || submission.getVersionId() == null) {
            return Mono.error(new IllegalArgumentException("Benchmark submission must reference a version"));
        }
        log.info("Recording benchmark result for version {} (suite {})", submission.getVersionId(), submission.getSuiteId());

        double threshold = submission.getGateThreshold() != null
            ? submission.getGateThreshold()
            : registryProperties.getBenchmark().getGateThreshold();

        return Mono.fromRunnable(() -> {
                checkMapKeys(submission.getDimensionScores());
                checkMapKeys(submission.getWeights());
            })
            .then(Mono.defer(() -> promptVersionService.getVersionById(submission.getVersionId())))
            .flatMap(version -> {
                ScoreAggregate aggregate = benchmarkScoreAggregator.aggregate(
                    submission.getDimensionScores(), submission.getBaselineScore(), threshold, submission.getWeights());

                BenchmarkResult result = BenchmarkResult.builder()
                    .promptId(version.getPromptId())
                    .versionId(version.getId())
                    .versionString(version.getVersionString())
                    .suiteId(submission.getSuiteId() != null ? submission.getSuiteId() : DEFAULT_SUITE)
                    .dimensionScores(new LinkedHashMap<>(submission.getDimensionScores()))
                    .weights(submission.getWeights())
                    .overallScore(aggregate.getOverallScore())
                    .baselineScore(submission.getBaselineScore())
                    .delta(aggregate.getDelta())
                    .gateThreshold(aggregate.getGateThreshold())
                    .gatePassed(aggregate.isGatePassed())
                    .modelId(submission.getModelId())
                    .environment(submission.getEnvironment() != null ? submission.getEnvironment() : DEFAULT_ENVIRONMENT)
                    .executedBy(submission.getExecutedBy())
                    .executedAt(submission.getExecutedAt() != null ? submission.getExecutedAt() : clock.instant())
                    .build();

                return benchmarkResultRepository.save(result);
            })
            .doOnSuccess(saved -> log.info("Recorded benchmark {} for version {}: overall {} (gate {})",
                saved.getId(), saved.getVersionString(), saved.getOverallScore(), saved.isGatePassed() ? "passed" : "failed"))
            .doOnError(error -> log.error("Error recording benchmark for version {}: {}", submission.getVersionId(), error.getMessage()));
    }

    private static void checkMapKeys(Map<String, Double> values) {
        if (values == null) {
            return;
        }
        for (String dimension : values.keySet()) {
            if (dimension == null || dimension.isBlank() || dimension.contains(MongoReactiveConfig.MAP_KEY_DOT_REPLACEMENT)) {
                throw new InvalidScoreException(String.format(
                    "Dimension name '%s' is blank or contains the reserved character U+FF0E", dimension));
            }
        }
    }

    @Override
    public Mono<BenchmarkResult> getLatestResult(String versionId) {
        return benchmarkResultRepository.findFirstByVersionIdOrderByExecutedAtDesc(versionId)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException(
                "No benchmark results found for version: " + versionId, ErrorCode.BENCHMARK_NOT_FOUND)));
    }

    @Override
    public Flux<BenchmarkResult> getResultsForVersion(String versionId) {
        return benchmarkResultRepository.findByVersionIdOrderByExecutedAtDesc(versionId);
    }

    @Override
    public Flux<BenchmarkResult> getHistory(String promptId, int limit) {
        if (limit <= 0) {
            return Flux.error(new IllegalArgumentException("Limit must be positive"));
        }
        return benchmarkResultRepository.findByPromptIdOrderByExecutedAtDesc(promptId)
            .take(limit);
    }

    @Override
    public Flux<BenchmarkResult> getHistory(String promptId, Instant executedAt, int limit) {
        if (limit <= 0) {
            return Flux.error(new IllegalArgumentException("Limit must be positive"));
        }
        if (executedAt == null) {
            return getHistory(promptId, limit);
        }
        return benchmarkResultRepository.findByPromptIdAndExecutedAtLessThanEqualOrderByExecutedAtDesc(promptId, executedAt)
            .take(limit);
    }

    @Override
    public Mono<BenchmarkTrends> getTrends(String promptId, int days) {
        if (days <= 0) {
            return Mono.error(new IllegalArgumentException("Trend window must be at least one day"));
        }
        Instant now = clock.instant();

        return benchmarkResultRepository
            .findByPromptIdAndExecutedAtGreaterThanEqualOrderByExecutedAtAsc(promptId, now.minus(Duration.ofDays(days)))
            .collectList()
            .map(results -> analyzeTrends(promptId, days, results, now))
            .doOnSuccess(trends -> log.debug("Trends for prompt {} over {} days: 7d avg {}, regressing {}",
                promptId, days, trends.getRollingAverage7d(), trends.isRegressing()))
            .doOnError(error -> log.error("Error analyzing benchmark trends for prompt {}: {}", promptId, error.getMessage()));
    }

    private BenchmarkTrends analyzeTrends(String promptId, int days, List<BenchmarkResult> results, Instant now) {
        Instant shortCutoff = now.minus(SHORT_WINDOW);
        Instant longCutoff = now.minus(LONG_WINDOW);

        List<Double> shortScores = scores(results, shortCutoff, true);
        List<Double> longScores = scores(results, longCutoff, true);
        Double shortAverage = average(shortScores);
        Double longAverage = average(longScores);

        List<Double> beforeShort = scores(results, shortCutoff, false);
        List<Double> beforeLong = scores(results, longCutoff, false);
        Double shortDelta = shortAverage != null && !beforeShort.isEmpty()
            ? shortAverage - average(lastRuns(beforeShort, SHORT_BASELINE_RUNS))
            : null;
        Double longDelta = longAverage != null && !beforeLong.isEmpty()
            ? longAverage - average(lastRuns(beforeLong, LONG_BASELINE_RUNS))
            : null;

        String alert = null;
        if (shortScores.size() >= RECENT_RUNS) {
            double recentAverage = average(lastRuns(shortScores, RECENT_RUNS));
            if (recentAverage < shortAverage - REGRESSION_DROP_POINTS) {
                alert = String.format(Locale.ROOT, "Score dropped %.1f points in last 7 days", shortAverage - recentAverage);
                log.warn("Prompt {} is regressing: {}", promptId, alert);
            }
        }

        List<TrendPoint> trendData = results.stream()
            .map(result -> TrendPoint.builder()
                .executedAt(result.getExecutedAt())
                .score(result.getOverallScore())
                .versionString(result.getVersionString())
                .modelId(result.getModelId())
                .build())
            .toList();

        return BenchmarkTrends.builder()
            .promptId(promptId)
            .days(days)
            .trendData(trendData)
            .rollingAverage7d(shortAverage)
            .rollingAverage30d(longAverage)
            .scoreDelta7d(shortDelta)
            .scoreDelta30d(longDelta)
            .regressing(alert != null)
            .regressionAlert(alert)
            .build();
    }

    // Results are oldest first, so the selected scores keep execution order
    private static List<Double> scores(List<BenchmarkResult> results, Instant cutoff, boolean atOrAfter) {
        return results.stream()
            .filter(result -> result.getExecutedAt() != null && result.getExecutedAt().isBefore(cutoff) != atOrAfter)
            .map(BenchmarkResult::getOverallScore)
            .toList();
    }

    private static List<Double> lastRuns(List<Double> scores, int count) {
        return scores.subList(Math.max(0, scores.size() - count), scores.size());
    }

    private static Double average(List<Double> scores) {
        if (scores.isEmpty()) {
            return null;
        }
        return scores.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }

    @Override
    public Flux<RegressionAlert> getRegressionAlerts() {
        log.info("Checking monitored prompts for benchmark regressions");

        return benchmarkResultRepository.findByExecutedAtGreaterThanEqual(clock.instant().minus(SHORT_WINDOW))
            .map(BenchmarkResult::getPromptId)
            .distinct()
            .collectList()
            .flatMapMany(promptIds -> promptRepository.findAllById(promptIds))
            .filter(prompt -> MONITORED_STATUSES.contains(prompt.getStatus()))
            .concatMap(prompt -> getTrends(prompt.getId(), ALERT_TREND_DAYS)
                .filter(BenchmarkTrends::isRegressing)
                .map(trends -> toAlert(prompt, trends)))
            .doOnError(error -> log.error("Error checking regression alerts: {}", error.getMessage()));
    }

    private static RegressionAlert toAlert(Prompt prompt, BenchmarkTrends trends) {
        return RegressionAlert.builder()
            .promptId(prompt.getId())
            .slug(prompt.getSlug())
            .alert(trends.getRegressionAlert())
            .rollingAverage7d(trends.getRollingAverage7d())
            .scoreDelta7d(trends.getScoreDelta7d())
            .build();
    }
}
