package org.lite.registry.exception;

import org.lite.registry.dto.ErrorCode;

public class ContentEncodingException extends PromptRegistryException {

    public ContentEncodingException(String message) {
        super(message, ErrorCode.CONTENT_ENCODING);
    }

    public ContentEncodingException(String message, Throwable cause) {
        super(message, ErrorCode.CONTENT_ENCODING, cause);
    }
}
