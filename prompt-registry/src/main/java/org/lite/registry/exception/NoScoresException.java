package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

/**
 * Exception thrown when aggregating a benchmark run that carries no dimension scores
 */
public class NoScoresException extends PromptRegistryException {

    public NoScoresException(String message) {
        super(message, ErrorCode.NO_SCORES);
    }
}
