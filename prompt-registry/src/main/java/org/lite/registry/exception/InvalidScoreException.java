package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

public class InvalidScoreException extends PromptRegistryException {

    public InvalidScoreException(String message) {
        super(message, ErrorCode.INVALID_SCORE);
    }
}
