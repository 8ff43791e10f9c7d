package org.lite.registry.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.config.RegistryProperties;
import org.lite.registry.dto.GateVerdict;
import org.lite.registry.service.BenchmarkResultService;
import org.lite.registry.service.PromptVersionService;
import org.lite.registry.service.QualityGateEvaluator;
import org.lite.registry.service.QualityGateRuleProvider;
import org.lite.registry.service.RolloutDecisionService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j
public class RolloutDecisionServiceImpl implements RolloutDecisionService {

    private final PromptVersionService promptVersionService;
    private final BenchmarkResultService benchmarkResultService;
    private final QualityGateRuleProvider qualityGateRuleProvider;
    private final QualityGateEvaluator qualityGateEvaluator;
    private final RegistryProperties registryProperties;

    @Override
    public Mono<GateVerdict> checkReadiness(String promptId, String environment) {
        log.info("Checking deployment readiness of prompt {} for environment {}", promptId, environment);
        int historyLimit = registryProperties.getBenchmark().getHistoryLimit();

        return promptVersionService.getVersion(promptId, null)
            .flatMap(head -> benchmarkResultService.getLatestResult(head.getId())
                // Results executed after the latest one cannot serve as its prior, so the window ends there
                .flatMap(latest -> Mono.zip(
                        qualityGateRuleProvider.getRules(environment),
                        benchmarkResultService.getHistory(promptId, latest.getExecutedAt(), historyLimit).collectList())
                    .map(inputs -> qualityGateEvaluator.evaluate(inputs.getT1(), latest, inputs.getT2())))
                .map(verdict -> verdict.toBuilder()
                    .promptId(promptId)
                    .versionString(head.getVersionString())
                    .environment(environment)
                    .build()))
            .doOnSuccess(verdict -> log.info("Prompt {} version {} for {}: {}",
                promptId, verdict.getVersionString(), environment, verdict.getSummary()))
            .doOnError(error -> log.error("Error checking readiness of prompt {} for {}: {}", promptId, environment, error.getMessage()));
    }
}
