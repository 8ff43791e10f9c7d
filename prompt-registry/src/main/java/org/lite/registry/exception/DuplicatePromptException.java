package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

public class DuplicatePromptException extends PromptRegistryException {

    public DuplicatePromptException(String message) {
        super(message, ErrorCode.PROMPT_ALREADY_EXISTS);
    }

    public DuplicatePromptException(String message, Throwable cause) {
        super(message, ErrorCode.PROMPT_ALREADY_EXISTS, cause);
    }
}
