package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

/**
 * Exception thrown when a configured quality gate rule cannot be evaluated, either because
 * its kind is unknown or because its parameters are missing. The whole evaluation fails.
 */
public class UnsupportedRuleException extends PromptRegistryException {

    public UnsupportedRuleException(String message) {
        super(message, ErrorCode.UNSUPPORTED_RULE);
    }

    public UnsupportedRuleException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }
}
