package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

public class InvalidVersionException extends PromptRegistryException {

    public InvalidVersionException(String message) {
        super(message, ErrorCode.INVALID_VERSION);
    }
}
