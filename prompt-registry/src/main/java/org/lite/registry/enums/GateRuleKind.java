package org.lite.registry.enums;

import lombok.Getter;
import org.lite.registry.exception.UnsupportedRuleException;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
public enum GateRuleKind {
    MINIMUM_SCORE("minimum_score"),
    DIMENSION_FLOOR("dimension_floor"),
    NO_REGRESSION("no_regression"),
    BENCHMARK_FRESHNESS("benchmark_freshness");

    private final String value;

    GateRuleKind(String value) {
        this.value = value;
    }

    /**
     * Resolves a configured kind name. Accepts the snake_case value or the enum name, case-insensitively.
     */
    public static GateRuleKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedRuleException("Quality gate rule kind is missing");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(normalized) || kind.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedRuleException(String.format(
                        "Unsupported quality gate rule kind '%s' (supported: %s)", value,
                        Arrays.stream(values()).map(GateRuleKind::getValue).collect(Collectors.joining(", ")))));
    }
}
