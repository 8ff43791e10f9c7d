package org.lite.registry.exception;

import lombok.Getter;
import org.lite.registry.dto.ErrorCode;

/**
 * Base type for every failure raised by the registry core. Callers can switch on
 * {@link #getErrorCode()} instead of the concrete subclass.
 */
@Getter
public class PromptRegistryException extends RuntimeException {

    private final ErrorCode errorCode;

    public PromptRegistryException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public PromptRegistryException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
