package org.lite.registry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.config.QualityGateProperties;
import org.lite.registry.config.QualityGateProperties.RuleDefinition;
import org.lite.registry.dto.ErrorCode;
import org.lite.registry.enums.GateRuleKind;
import org.lite.registry.exception.ResourceNotFoundException;
import org.lite.registry.exception.UnsupportedRuleException;
import org.lite.registry.model.GateRuleParameters;
import org.lite.registry.model.QualityGateRule;
import org.lite.registry.service.QualityGateRuleProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads gate rules from {@code registry.quality-gates.environments}. Definitions are converted on every
 * request, so a misconfigured rule fails the evaluation that needs it rather than application startup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PropertiesQualityGateRuleProvider implements QualityGateRuleProvider {

    private final QualityGateProperties qualityGateProperties;

    @Override
    public Mono<List<QualityGateRule>> getRules(String environment) {
        return Mono.fromCallable(() -> {
                    if (!qualityGateProperties.getEnvironments().containsKey(environment)) {
                        throw new ResourceNotFoundException(
                                "No quality gate rules configured for environment: " + environment, ErrorCode.GATE_RULES_NOT_FOUND);
                    }
                    List<QualityGateRule> rules = new ArrayList<>();
                    List<RuleDefinition> definitions = qualityGateProperties.rulesFor(environment);
                    for (int i = 0; i < definitions.size(); i++) {
                        rules.add(toRule(environment, i, definitions.get(i)));
                    }
                    return List.copyOf(rules);
                })
                .doOnError(error -> log.error("Error loading quality gate rules for environment {}: {}", environment, error.getMessage()));
    }

    @Override
    public Set<String> getEnvironments() {
        return new LinkedHashSet<>(qualityGateProperties.getEnvironments().keySet());
    }

    private QualityGateRule toRule(String environment, int position, RuleDefinition definition) {
        String id = definition.getId() != null ? definition.getId() : environment + "-rule-" + (position + 1);
        String name = definition.getName() != null ? definition.getName() : id;
        GateRuleKind kind = GateRuleKind.fromValue(definition.getKind());

        GateRuleParameters parameters = switch (kind) {
            case MINIMUM_SCORE -> new GateRuleParameters.MinimumScore(require(id, "threshold", definition.getThreshold()));
            case DIMENSION_FLOOR -> new GateRuleParameters.DimensionFloor(
                    requireDimension(id, definition.getDimension()), require(id, "threshold", definition.getThreshold()));
            case NO_REGRESSION -> new GateRuleParameters.NoRegression(
                    definition.getTolerance() != null ? definition.getTolerance() : 0.0);
            case BENCHMARK_FRESHNESS -> new GateRuleParameters.BenchmarkFreshness(
                    require(id, "max-age-hours", definition.getMaxAgeHours()));
        };

        return QualityGateRule.builder()
                .id(id)
                .name(name)
                .blocking(definition.isBlocking())
                .parameters(parameters)
                .build();
    }

    private static <T> T require(String ruleId, String parameter, T value) {
        if (value == null) {
            throw new UnsupportedRuleException(String.format(
                    "Quality gate rule '%s' is missing parameter '%s'", ruleId, parameter), ErrorCode.INVALID_RULE_CONFIGURATION);
        }
        return value;
    }

    private static String requireDimension(String ruleId, String dimension) {
        if (dimension == null || dimension.isBlank()) {
            throw new UnsupportedRuleException(String.format(
                    "Quality gate rule '%s' is missing parameter 'dimension'", ruleId), ErrorCode.INVALID_RULE_CONFIGURATION);
        }
        return dimension;
    }
}
