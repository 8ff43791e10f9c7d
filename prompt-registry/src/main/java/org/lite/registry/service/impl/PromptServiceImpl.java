package org.lite.registry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.dto.ErrorCode;
import org.lite.registry.entity.Prompt;
import org.lite.registry.enums.PromptStatus;
import org.lite.registry.exception.DuplicatePromptException;
import org.lite.registry.exception.ResourceNotFoundException;
import org.lite.registry.repository.BenchmarkResultRepository;
import org.lite.registry.repository.PromptRepository;
import org.lite.registry.repository.PromptVersionRepository;
import org.lite.registry.service.PromptService;
import org.lite.registry.service.PromptVersionService;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class PromptServiceImpl implements PromptService {

    private final PromptRepository promptRepository;
    private final PromptVersionRepository promptVersionRepository;
    private final BenchmarkResultRepository benchmarkResultRepository;
    private final PromptVersionService promptVersionService;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    @Override
    public Mono<Prompt> registerPrompt(String slug, String name, String description, String createdBy) {
        if (slug == null || slug.isBlank()) {
            return Mono.error(new IllegalArgumentException("Prompt slug cannot be null or empty"));
        }
        log.info("Registering prompt with slug: {}", slug);

        Instant now = clock.instant();
        Prompt prompt = Prompt.builder()
            .slug(slug.trim())
            .name(name != null ? name : slug.trim())
            .description(description)
            .status(PromptStatus.DRAFT)
            .headSequence(0)
            .createdAt(now)
            .updatedAt(now)
            .createdBy(createdBy)
            .build();

        return promptRepository.existsBySlug(prompt.getSlug())
            .flatMap(exists -> exists
                ? Mono.<Prompt>error(new DuplicatePromptException("Prompt slug already in use: " + prompt.getSlug()))
                : promptRepository.save(prompt))
            .onErrorMap(DuplicateKeyException.class,
                error -> new DuplicatePromptException("Prompt slug already in use: " + prompt.getSlug(), error))
            .doOnSuccess(saved -> log.info("Registered prompt {} with id: {}", saved.getSlug(), saved.getId()))
            .doOnError(error -> log.error("Error registering prompt {}: {}", slug, error.getMessage()));
    }

    @Override
    public Mono<Prompt> getPrompt(String promptId) {
        return promptRepository.findById(promptId)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException("Prompt not found with id: " + promptId, ErrorCode.PROMPT_NOT_FOUND)));
    }

    @Override
    public Mono<Prompt> getPromptBySlug(String slug) {
        return promptRepository.findBySlug(slug)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException("Prompt not found with slug: " + slug, ErrorCode.PROMPT_NOT_FOUND)));
    }

    @Override
    public Mono<Prompt> updateStatus(String promptId, PromptStatus status, String versionString) {
        if (status == null) {
            return Mono.error(new IllegalArgumentException("Status cannot be null"));
        }
        log.info("Updating status of prompt {} to {} at version {}", promptId, status, versionString != null ? versionString : "HEAD");

        return promptVersionService.getVersion(promptId, versionString)
            .flatMap(version -> promptRepository.updateStatus(promptId, status, version.getVersionString(), clock.instant()))
            .switchIfEmpty(Mono.error(new ResourceNotFoundException("Prompt not found with id: " + promptId, ErrorCode.PROMPT_NOT_FOUND)))
            .doOnSuccess(prompt -> log.info("Prompt {} is now {} at version {}", promptId, prompt.getStatus(), prompt.getStatusVersion()))
            .doOnError(error -> log.error("Error updating status of prompt {}: {}", promptId, error.getMessage()));
    }

    @Override
    public Mono<Void> deletePrompt(String promptId) {
        log.info("Deleting prompt {} with all versions and benchmark results", promptId);

        Mono<Void> cascade = getPrompt(promptId)
            .flatMap(prompt -> benchmarkResultRepository.deleteByPromptId(promptId)
                .then(promptVersionRepository.deleteByPromptId(promptId))
                .then(promptRepository.deleteById(promptId)));

        return transactionalOperator.transactional(cascade)
            .doOnSuccess(v -> log.info("Deleted prompt: {}", promptId))
            .doOnError(error -> log.error("Error deleting prompt {}: {}", promptId, error.getMessage()));
    }
}
