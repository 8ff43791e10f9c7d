package org.lite.registry.service;

import org.lite.registry.dto.DiffResult;
import org.lite.registry.entity.PromptVersion;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface PromptVersionService {

    /**
     * Create a new head version. Returns the current head unchanged when its content is identical.
     *
     * @param explicitVersion optional version string; must be strictly greater than the head, otherwise PATCH is incremented
     */
    Mono<PromptVersion> createVersion(String promptId, String content, String changeSummary,
                                      String authorId, String explicitVersion);

    /**
     * Get a specific version, or the head when {@code versionString} is null
     */
    Mono<PromptVersion> getVersion(String promptId, String versionString);

    /**
     * Get a version by its id
     */
    Mono<PromptVersion> getVersionById(String versionId);

    /**
     * List versions of a prompt, newest first
     */
    Flux<PromptVersion> listVersions(String promptId, int limit, int offset);

    /**
     * Compute the diff between two versions. A null version string stands for the head.
     */
    Mono<DiffResult> diff(String promptId, String fromVersion, String toVersion);

    /**
     * Render the diff between two versions as unified diff text
     */
    Mono<String> renderDiff(String promptId, String fromVersion, String toVersion);

    /**
     * Create a new head version carrying the content of an older version. History is never rewritten.
     */
    Mono<PromptVersion> rollback(String promptId, String toVersion, String authorId, String reason);

    /**
     * Get version count for a prompt
     */
    Mono<Long> countVersions(String promptId);
}
