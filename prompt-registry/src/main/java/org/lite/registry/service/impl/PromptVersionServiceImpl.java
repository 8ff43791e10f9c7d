package org.lite.registry.service.impl;

import com.mongodb.MongoException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.config.RegistryProperties;
import org.lite.registry.dto.DiffChunk;
import org.lite.registry.dto.DiffResult;
import org.lite.registry.dto.ErrorCode;
import org.lite.registry.entity.Prompt;
import org.lite.registry.entity.PromptVersion;
import org.lite.registry.exception.ContentIntegrityException;
import org.lite.registry.exception.InvalidVersionException;
import org.lite.registry.exception.ResourceNotFoundException;
import org.lite.registry.exception.VersionConflictException;
import org.lite.registry.repository.PromptRepository;
import org.lite.registry.repository.PromptVersionRepository;
import org.lite.registry.service.ContentHasher;
import org.lite.registry.service.DiffEngine;
import org.lite.registry.service.PromptVersionService;
import org.lite.registry.service.UnifiedDiffRenderer;
import org.semver4j.Semver;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class PromptVersionServiceImpl implements PromptVersionService {

    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d+\\.\\d+\\.\\d+");
    private static final int WRITE_CONFLICT_CODE = 112;

    private record CreateCommand(String promptId, String content, String contentHash,
                                 String changeSummary, String authorId, String explicitVersion) {
    }

    private final PromptRepository promptRepository;
    private final PromptVersionRepository promptVersionRepository;
    private final ContentHasher contentHasher;
    private final DiffEngine diffEngine;
    private final UnifiedDiffRenderer unifiedDiffRenderer;
    private final TransactionalOperator transactionalOperator;
    private final RegistryProperties registryProperties;
    private final Clock clock;

    @Override
    public Mono<PromptVersion> createVersion(String promptId, String content, String changeSummary,
                                             String authorId, String explicitVersion) {
        log.info("Creating new version for prompt: {} by author: {}", promptId, authorId);

        return Mono.fromCallable(() -> contentHasher.hash(content))
            .map(contentHash -> new CreateCommand(promptId, content, contentHash, changeSummary, authorId, explicitVersion))
            .flatMap(command -> attemptCreate(command, 1))
            .doOnSuccess(version -> log.info("Prompt {} head is version {}", promptId, version.getVersionString()))
            .doOnError(error -> log.error("Error creating version for prompt {}: {}", promptId, error.getMessage()));
    }

    private Mono<PromptVersion> attemptCreate(CreateCommand command, int attempt) {
        return findPrompt(command.promptId())
            .flatMap(prompt -> loadHead(prompt)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(head -> appendOrReuse(prompt, head.orElse(null), command, attempt)));
    }

    private Mono<PromptVersion> appendOrReuse(Prompt prompt, PromptVersion head, CreateCommand command, int attempt) {
        if (head != null && verifyIntegrity(head).getContentHash().equals(command.contentHash())) {
            log.info("Content of prompt {} is unchanged, keeping head version {}", prompt.getId(), head.getVersionString());
            return Mono.just(head);
        }

        String nextVersion = nextVersionString(head, command.explicitVersion());
        List<DiffChunk> diffFromParent = head != null ? diffEngine.diff(head.getContent(), command.content()) : null;
        String expectedHead = prompt.getHeadVersion();

        PromptVersion newVersion = PromptVersion.builder()
            .promptId(prompt.getId())
            .versionString(nextVersion)
            .sequence(prompt.getHeadSequence() + 1)
            .changeSummary(command.changeSummary())
            .authorId(command.authorId())
            .createdAt(nextTimestamp(head))
            .content(command.content())
            .contentHash(command.contentHash())
            .diffFromParent(diffFromParent)
            .build();

        // Moving the head pointer and inserting the version commit together or not at all
        Mono<PromptVersion> append = promptRepository
            .compareAndSetHead(prompt.getId(), expectedHead, nextVersion, newVersion.getSequence(), newVersion.getCreatedAt())
            .flatMap(updatedPrompt -> promptVersionRepository.save(newVersion));

        return transactionalOperator.transactional(append)
            .onErrorMap(DuplicateKeyException.class, error -> new VersionConflictException(
                "Version " + nextVersion + " already exists for prompt: " + prompt.getId(), error))
            // A concurrent transaction holding the prompt document aborts ours; retry from the head it leaves behind
            .onErrorResume(PromptVersionServiceImpl::isTransientWriteConflict, error -> {
                log.warn("Transaction for prompt {} aborted by a concurrent write: {}", prompt.getId(), error.getMessage());
                return afterHeadMoved(command, expectedHead, attempt);
            })
            .switchIfEmpty(Mono.defer(() -> afterHeadMoved(command, expectedHead, attempt)));
    }

    private static boolean isTransientWriteConflict(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof TransientDataAccessException) {
                return true;
            }
            if (cause instanceof MongoException mongoException
                    && (mongoException.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)
                        || mongoException.getCode() == WRITE_CONFLICT_CODE)) {
                return true;
            }
        }
        return false;
    }

    private Mono<PromptVersion> afterHeadMoved(CreateCommand command, String expectedHead, int attempt) {
        int maxAttempts = registryProperties.getVersioning().getMaxHeadUpdateAttempts();
        if (attempt >= maxAttempts) {
            return Mono.error(new VersionConflictException(String.format(
                "Head of prompt %s kept moving under concurrent writes, gave up after %d attempts",
                command.promptId(), attempt)));
        }
        log.warn("Head of prompt {} moved away from {} during version creation, re-reading (attempt {}/{})",
            command.promptId(), expectedHead, attempt + 1, maxAttempts);
        return attemptCreate(command, attempt + 1);
    }

    private Mono<PromptVersion> loadHead(Prompt prompt) {
        if (!prompt.hasVersions()) {
            return Mono.empty();
        }
        return promptVersionRepository.findByPromptIdAndVersionString(prompt.getId(), prompt.getHeadVersion())
            .switchIfEmpty(Mono.error(new ResourceNotFoundException(
                "Head version " + prompt.getHeadVersion() + " not found for prompt: " + prompt.getId(), ErrorCode.VERSION_NOT_FOUND)));
    }

    private String nextVersionString(PromptVersion head, String explicitVersion) {
        if (explicitVersion != null && !explicitVersion.isBlank()) {
            Semver requested = parseVersion(explicitVersion.trim());
            if (head != null && requested.compareTo(parseVersion(head.getVersionString())) <= 0) {
                throw new VersionConflictException(String.format(
                    "Version %s is not greater than head version %s", explicitVersion, head.getVersionString()));
            }
            return requested.getVersion();
        }
        if (head == null) {
            return parseVersion(registryProperties.getVersioning().getInitialVersion()).getVersion();
        }
        return parseVersion(head.getVersionString()).nextPatch().getVersion();
    }

    private static Semver parseVersion(String version) {
        Semver semver = version != null && VERSION_PATTERN.matcher(version).matches() ? Semver.parse(version) : null;
        if (semver == null) {
            throw new InvalidVersionException("Version must have the form MAJOR.MINOR.PATCH: " + version);
        }
        return semver;
    }

    private Instant nextTimestamp(PromptVersion head) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (head != null && head.getCreatedAt() != null && !now.isAfter(head.getCreatedAt())) {
            return head.getCreatedAt().plusMillis(1);
        }
        return now;
    }

    @Override
    public Mono<PromptVersion> getVersion(String promptId, String versionString) {
        log.info("Fetching version {} for prompt: {}", versionString != null ? versionString : "HEAD", promptId);

        return findPrompt(promptId)
            .flatMap(prompt -> {
                String target = versionString != null && !versionString.isBlank() ? versionString : prompt.getHeadVersion();
                if (target == null) {
                    return Mono.error(new ResourceNotFoundException(
                        "No versions found for prompt: " + promptId, ErrorCode.VERSION_NOT_FOUND));
                }
                return promptVersionRepository.findByPromptIdAndVersionString(promptId, target)
                    .switchIfEmpty(Mono.error(new ResourceNotFoundException(
                        "Version " + target + " not found for prompt: " + promptId, ErrorCode.VERSION_NOT_FOUND)));
            })
            .map(this::verifyIntegrity)
            .doOnError(error -> log.error("Error fetching version {} for prompt {}: {}", versionString, promptId, error.getMessage()));
    }

    @Override
    public Mono<PromptVersion> getVersionById(String versionId) {
        return promptVersionRepository.findById(versionId)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException(
                "Prompt version not found with id: " + versionId, ErrorCode.VERSION_NOT_FOUND)))
            .map(this::verifyIntegrity);
    }

    @Override
    public Flux<PromptVersion> listVersions(String promptId, int limit, int offset) {
        if (limit <= 0 || offset < 0) {
            return Flux.error(new IllegalArgumentException("Limit must be positive and offset non-negative"));
        }
        log.info("Fetching version history for prompt: {} (limit {}, offset {})", promptId, limit, offset);

        return findPrompt(promptId)
            .flatMapMany(prompt -> promptVersionRepository.findByPromptIdOrderBySequenceDesc(promptId))
            .skip(offset)
            .take(limit)
            .map(this::verifyIntegrity)
            .doOnError(error -> log.error("Error fetching version history for prompt {}: {}", promptId, error.getMessage()));
    }

    @Override
    public Mono<DiffResult> diff(String promptId, String fromVersion, String toVersion) {
        log.info("Computing diff for prompt {} from {} to {}", promptId, fromVersion, toVersion);

        return Mono.zip(getVersion(promptId, fromVersion), getVersion(promptId, toVersion))
            .map(versions -> {
                PromptVersion from = versions.getT1();
                PromptVersion to = versions.getT2();
                List<DiffChunk> chunks = from.getContentHash().equals(to.getContentHash())
                    ? List.of()
                    : diffEngine.diff(from.getContent(), to.getContent());
                return DiffResult.builder()
                    .promptId(promptId)
                    .fromVersion(from.getVersionString())
                    .toVersion(to.getVersionString())
                    .fromContentHash(from.getContentHash())
                    .toContentHash(to.getContentHash())
                    .chunks(chunks)
                    .build();
            });
    }

    @Override
    public Mono<String> renderDiff(String promptId, String fromVersion, String toVersion) {
        log.info("Rendering diff for prompt {} from {} to {}", promptId, fromVersion, toVersion);

        return Mono.zip(getVersion(promptId, fromVersion), getVersion(promptId, toVersion))
            .map(versions -> unifiedDiffRenderer.render(versions.getT1(), versions.getT2(),
                registryProperties.getDiff().getContextLines()));
    }

    @Override
    public Mono<PromptVersion> rollback(String promptId, String toVersion, String authorId, String reason) {
        if (toVersion == null || toVersion.isBlank()) {
            return Mono.error(new IllegalArgumentException("Rollback target version is required"));
        }
        log.info("Rolling back prompt {} to version: {}", promptId, toVersion);

        String changeSummary = reason == null || reason.isBlank()
            ? "Rollback to version " + toVersion
            : "Rollback to version " + toVersion + ": " + reason;

        return getVersion(promptId, toVersion)
            .flatMap(target -> createVersion(promptId, target.getContent(), changeSummary, authorId, null))
            .doOnSuccess(version -> log.info("Rolled back prompt {} to the content of {} as version {}",
                promptId, toVersion, version.getVersionString()))
            .doOnError(error -> log.error("Error rolling back prompt {} to version {}: {}", promptId, toVersion, error.getMessage()));
    }

    @Override
    public Mono<Long> countVersions(String promptId) {
        return findPrompt(promptId)
            .flatMap(prompt -> promptVersionRepository.countByPromptId(promptId));
    }

    private Mono<Prompt> findPrompt(String promptId) {
        return promptRepository.findById(promptId)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException("Prompt not found with id: " + promptId, ErrorCode.PROMPT_NOT_FOUND)));
    }

    private PromptVersion verifyIntegrity(PromptVersion version) {
        if (!contentHasher.matches(version.getContent(), version.getContentHash())) {
            throw new ContentIntegrityException(String.format(
                "Content of version %s of prompt %s does not match its stored hash",
                version.getVersionString(), version.getPromptId()));
        }
        return version;
    }
}
