package org.lite.registry.dto;

import lombok.Getter;

@Getter
public enum ErrorCode {
    PROMPT_NOT_FOUND("Prompt not found", 404),
    VERSION_NOT_FOUND("Prompt version not found", 404),
    BENCHMARK_NOT_FOUND("Benchmark result not found", 404),
    GATE_RULES_NOT_FOUND("Quality gate rules not configured", 404),
    PROMPT_ALREADY_EXISTS("Prompt slug already in use", 409),
    VERSION_CONFLICT("Version conflict", 409),
    INVALID_VERSION("Invalid semantic version", 400),
    CONTENT_TOO_LARGE("Content too large", 413),
    CONTENT_ENCODING("Content is not valid UTF-8", 400),
    CONTENT_INTEGRITY("Stored content does not match its hash", 500),
    DIFF_MISMATCH("Diff does not apply to content", 422),
    NO_SCORES("No dimension scores supplied", 400),
    INVALID_SCORE("Invalid benchmark score", 400),
    UNSUPPORTED_RULE("Unsupported quality gate rule", 422),
    INVALID_RULE_CONFIGURATION("Invalid quality gate rule configuration", 422);

    private final String defaultMessage;
    private final int httpStatus;

    ErrorCode(String defaultMessage, int httpStatus) {
        this.defaultMessage = defaultMessage;
        this.httpStatus = httpStatus;
    }
}
