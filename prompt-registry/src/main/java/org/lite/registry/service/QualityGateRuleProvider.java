package org.lite.registry.service;

import org.lite.registry.model.QualityGateRule;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

public interface QualityGateRuleProvider {

    /**
     * Get the ordered quality gate rules of a deployment environment, validated and typed
     */
    Mono<List<QualityGateRule>> getRules(String environment);

    /**
     * Get the names of all environments with configured rules
     */
    Set<String> getEnvironments();
}
