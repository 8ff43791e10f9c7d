package org.lite.registry.repository;

import org.lite.registry.entity.BenchmarkResult;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface BenchmarkResultRepository extends ReactiveMongoRepository<BenchmarkResult, String> {

    Mono<BenchmarkResult> findFirstByVersionIdOrderByExecutedAtDesc(String versionId);

    Flux<BenchmarkResult> findByPromptIdOrderByExecutedAtDesc(String promptId);

    Flux<BenchmarkResult> findByPromptIdAndExecutedAtLessThanEqualOrderByExecutedAtDesc(String promptId, Instant executedAt);

    Flux<BenchmarkResult> findByPromptIdAndExecutedAtGreaterThanEqualOrderByExecutedAtAsc(String promptId, Instant cutoff);

    Flux<BenchmarkResult> findByExecutedAtGreaterThanEqual(Instant cutoff);

    Flux<BenchmarkResult> findByVersionIdOrderByExecutedAtDesc(String versionId);

    Mono<Long> deleteByPromptId(String promptId);
}
