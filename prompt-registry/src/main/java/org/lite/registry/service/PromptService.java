package org.lite.registry.service;

import org.lite.registry.entity.Prompt;
import org.lite.registry.enums.PromptStatus;
import reactor.core.publisher.Mono;

public interface PromptService {

    /**
     * Register a new prompt without any versions, in DRAFT status
     */
    Mono<Prompt> registerPrompt(String slug, String name, String description, String createdBy);

    Mono<Prompt> getPrompt(String promptId);

    Mono<Prompt> getPromptBySlug(String slug);

    /**
     * Move a prompt to a lifecycle status. The status always refers to an existing version, the head when
     * {@code versionString} is null.
     */
    Mono<Prompt> updateStatus(String promptId, PromptStatus status, String versionString);

    /**
     * Delete a prompt together with all of its versions and benchmark results
     */
    Mono<Void> deletePrompt(String promptId);
}
