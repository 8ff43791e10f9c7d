package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

/**
 * Exception thrown when a new version would not be strictly greater than the head,
 * or when the head kept moving under concurrent writers. Callers should re-read the head and retry.
 */
public class VersionConflictException extends PromptRegistryException {

    public VersionConflictException(String message) {
        super(message, ErrorCode.VERSION_CONFLICT);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, ErrorCode.VERSION_CONFLICT, cause);
    }
}
