package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

/**
 * Exception thrown when a stored version's content no longer hashes to its recorded content hash
 */
public class ContentIntegrityException extends PromptRegistryException {

    public ContentIntegrityException(String message) {
        super(message, ErrorCode.CONTENT_INTEGRITY);
    }
}
