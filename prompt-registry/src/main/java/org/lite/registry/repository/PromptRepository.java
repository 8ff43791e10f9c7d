package org.lite.registry.repository;

import org.lite.registry.entity.Prompt;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface PromptRepository extends ReactiveMongoRepository<Prompt, String>, PromptRepositoryCustom {

    Mono<Prompt> findBySlug(String slug);

    Mono<Boolean> existsBySlug(String slug);
}
