package org.lite.registry.repository;

import org.lite.registry.entity.Prompt;
import org.lite.registry.enums.PromptStatus;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Targeted updates on the prompt document. The head pointer must never be written with a full-document save.
 */
public interface PromptRepositoryCustom {

    /**
     * Moves the head pointer only if it still equals {@code expectedHeadVersion} ({@code null} for an empty prompt).
     *
     * @return the updated prompt, or empty when another writer moved the head first
     */
    Mono<Prompt> compareAndSetHead(String promptId, String expectedHeadVersion,
                                   String newHeadVersion, long newHeadSequence, Instant updatedAt);

    /**
     * Updates the lifecycle status without touching the head pointer.
     */
    Mono<Prompt> updateStatus(String promptId, PromptStatus status, String statusVersion, Instant updatedAt);
}
