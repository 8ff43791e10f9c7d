package org.lite.registry.repository;

import org.lite.registry.entity.PromptVersion;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PromptVersionRepository extends ReactiveMongoRepository<PromptVersion, String> {

    /**
     * Find a specific version of a prompt by its version string
     */
    Mono<PromptVersion> findByPromptIdAndVersionString(String promptId, String versionString);

    /**
     * Find all versions of a prompt, newest first
     */
    Flux<PromptVersion> findByPromptIdOrderBySequenceDesc(String promptId);

    Mono<Long> countByPromptId(String promptId);

    Mono<Long> deleteByPromptId(String promptId);
}
