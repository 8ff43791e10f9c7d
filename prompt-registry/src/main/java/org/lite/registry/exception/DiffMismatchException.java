package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

public class DiffMismatchException extends PromptRegistryException {

    public DiffMismatchException(String message) {
        super(message, ErrorCode.DIFF_MISMATCH);
    }
}
