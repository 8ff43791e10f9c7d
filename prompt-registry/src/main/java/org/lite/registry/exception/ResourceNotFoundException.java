package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

/**
 * Exception thrown when a referenced prompt, version or benchmark result does not exist
 */
public class ResourceNotFoundException extends PromptRegistryException {

    public ResourceNotFoundException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }
}
