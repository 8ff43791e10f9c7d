package org.lite.registry.service;

import org.lite.registry.dto.GateVerdict;
import reactor.core.publisher.Mono;

public interface RolloutDecisionService {

    /**
     * Decide whether the head version of a prompt may be deployed to an environment, based on its latest
     * benchmark result, the prompt's recent benchmark history and the environment's quality gate rules
     */
    Mono<GateVerdict> checkReadiness(String promptId, String environment);
}
