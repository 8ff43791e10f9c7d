package org.lite.registry.service;

import org.lite.registry.dto.BenchmarkSubmission;
import org.lite.registry.dto.BenchmarkTrends;
import org.lite.registry.dto.RegressionAlert;
import org.lite.registry.entity.BenchmarkResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

public interface BenchmarkResultService {

    /**
     * Aggregate a finished benchmark run and append it to the version's results
     */
    Mono<BenchmarkResult> recordResult(BenchmarkSubmission submission);

    /**
     * Get the most recently executed result of a version
     */
    Mono<BenchmarkResult> getLatestResult(String versionId);

    /**
     * Get all results of a version, newest first
     */
    Flux<BenchmarkResult> getResultsForVersion(String versionId);

    /**
     * Get the recent results of a prompt across all of its versions, newest first
     */
    Flux<BenchmarkResult> getHistory(String promptId, int limit);

    /**
     * Get the results of a prompt executed no later than {@code executedAt}, newest first
     */
    Flux<BenchmarkResult> getHistory(String promptId, Instant executedAt, int limit);

    /**
     * Rolling averages, score deltas and regression detection over the last {@code days} of results
     */
    Mono<BenchmarkTrends> getTrends(String promptId, int days);

    /**
     * Regression alerts for every staged or deployed prompt benchmarked during the last week
     */
    Flux<RegressionAlert> getRegressionAlerts();
}
