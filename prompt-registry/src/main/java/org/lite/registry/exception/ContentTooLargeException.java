package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

/**
 * Exception thrown when content exceeds the configured diff line limit
 */
public class ContentTooLargeException extends PromptRegistryException {

    public ContentTooLargeException(String message) {
        super(message, ErrorCode.CONTENT_TOO_LARGE);
    }
}
