package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.registry.config.RegistryProperties;
import org.lite.registry.dto.ErrorCode;
import org.lite.registry.entity.BenchmarkResult;
import org.lite.registry.entity.PromptVersion;
import org.lite.registry.enums.GateStatus;
import org.lite.registry.exception.ResourceNotFoundException;
import org.lite.registry.model.GateRuleParameters;
import org.lite.registry.model.QualityGateRule;
import org.lite.registry.service.BenchmarkResultService;
import org.lite.registry.service.PromptVersionService;
import org.lite.registry.service.QualityGateEvaluator;
import org.lite.registry.service.QualityGateRuleProvider;
import org.lite.registry.service.impl.RolloutDecisionServiceImpl;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RolloutDecisionServiceImplTest {

    private static final String PROMPT_ID = "prompt-1";
    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Mock
    private PromptVersionService promptVersionService;

    @Mock
    private BenchmarkResultService benchmarkResultService;

    @Mock
    private QualityGateRuleProvider qualityGateRuleProvider;

    private RegistryProperties registryProperties;
    private RolloutDecisionServiceImpl rolloutDecisionService;

    private final PromptVersion head = PromptVersion.builder()
            .id("version-2")
            .promptId(PROMPT_ID)
            .versionString("1.0.1")
            .build();

    @BeforeEach
    void setUp() {
        registryProperties = new RegistryProperties();
        rolloutDecisionService = new RolloutDecisionServiceImpl(promptVersionService, benchmarkResultService,
                qualityGateRuleProvider, new QualityGateEvaluator(Clock.fixed(NOW, ZoneOffset.UTC)), registryProperties);
    }

    @Test
    void testCheckReadiness_WarningDoesNotBlock() {
        // Given
        BenchmarkResult latest = BenchmarkResult.builder()
                .id("r2").promptId(PROMPT_ID).versionId("version-2").overallScore(80.0).executedAt(NOW).build();
        BenchmarkResult prior = BenchmarkResult.builder()
                .id("r1").promptId(PROMPT_ID).versionId("version-1").overallScore(85.0).executedAt(NOW.minus(Duration.ofDays(1))).build();
        List<QualityGateRule> rules = List.of(
                QualityGateRule.builder().id("score-minimum").name("Minimum Score")
                        .parameters(new GateRuleParameters.MinimumScore(75)).build(),
                QualityGateRule.builder().id("no-regression").name("No Regression").blocking(false)
                        .parameters(new GateRuleParameters.NoRegression(2)).build());

        when(promptVersionService.getVersion(PROMPT_ID, null)).thenReturn(Mono.just(head));
        when(benchmarkResultService.getLatestResult("version-2")).thenReturn(Mono.just(latest));
        when(benchmarkResultService.getHistory(PROMPT_ID, NOW, registryProperties.getBenchmark().getHistoryLimit()))
                .thenReturn(Flux.just(latest, prior));
        when(qualityGateRuleProvider.getRules("production")).thenReturn(Mono.just(rules));

        // When & Then
        StepVerifier.create(rolloutDecisionService.checkReadiness(PROMPT_ID, "production"))
                .assertNext(verdict -> {
                    assertTrue(verdict.isCanDeploy());
                    assertEquals(GateStatus.PASSED, verdict.getEvaluations().get(0).getStatus());
                    assertEquals(GateStatus.WARNING, verdict.getEvaluations().get(1).getStatus());
                    assertEquals(1, verdict.getWarnings().size());
                    assertTrue(verdict.getBlockers().isEmpty());
                    assertEquals(PROMPT_ID, verdict.getPromptId());
                    assertEquals("1.0.1", verdict.getVersionString(), "Verdict should name the evaluated head");
                    assertEquals("production", verdict.getEnvironment());
                })
                .verifyComplete();
    }

    @Test
    void testCheckReadiness_HistoryEndsAtLatestRun() {
        // Given - the head was benchmarked an hour ago, older versions have been re-run since
        Instant headRun = NOW.minus(Duration.ofHours(1));
        BenchmarkResult latest = BenchmarkResult.builder()
                .id("r2").promptId(PROMPT_ID).versionId("version-2").overallScore(70.0).executedAt(headRun).build();
        BenchmarkResult prior = BenchmarkResult.builder()
                .id("r1").promptId(PROMPT_ID).versionId("version-1").overallScore(85.0).executedAt(headRun.minus(Duration.ofDays(1))).build();
        List<QualityGateRule> rules = List.of(
                QualityGateRule.builder().id("no-regression").name("No Regression")
                        .parameters(new GateRuleParameters.NoRegression(2)).build());
        int historyLimit = registryProperties.getBenchmark().getHistoryLimit();

        when(promptVersionService.getVersion(PROMPT_ID, null)).thenReturn(Mono.just(head));
        when(benchmarkResultService.getLatestResult("version-2")).thenReturn(Mono.just(latest));
        when(benchmarkResultService.getHistory(PROMPT_ID, headRun, historyLimit)).thenReturn(Flux.just(latest, prior));
        when(qualityGateRuleProvider.getRules("production")).thenReturn(Mono.just(rules));

        // When & Then
        StepVerifier.create(rolloutDecisionService.checkReadiness(PROMPT_ID, "production"))
                .assertNext(verdict -> {
                    assertFalse(verdict.isCanDeploy(), "A drop against the run before the latest must block");
                    assertEquals(GateStatus.FAILED, verdict.getEvaluations().get(0).getStatus());
                })
                .verifyComplete();

        verify(benchmarkResultService, never()).getHistory(anyString(), anyInt());
    }

    @Test
    void testCheckReadiness_HeadWithoutBenchmark() {
        when(promptVersionService.getVersion(PROMPT_ID, null)).thenReturn(Mono.just(head));
        when(benchmarkResultService.getLatestResult("version-2")).thenReturn(Mono.error(
                new ResourceNotFoundException("No benchmark results found for version: version-2", ErrorCode.BENCHMARK_NOT_FOUND)));

        StepVerifier.create(rolloutDecisionService.checkReadiness(PROMPT_ID, "production"))
                .expectErrorSatisfies(error -> assertEquals(ErrorCode.BENCHMARK_NOT_FOUND,
                        ((ResourceNotFoundException) error).getErrorCode()))
                .verify();

        verifyNoInteractions(qualityGateRuleProvider);
    }

    @Test
    void testCheckReadiness_UnknownEnvironment() {
        BenchmarkResult latest = BenchmarkResult.builder().id("r2").versionId("version-2").overallScore(90.0).executedAt(NOW).build();
        when(promptVersionService.getVersion(PROMPT_ID, null)).thenReturn(Mono.just(head));
        when(benchmarkResultService.getLatestResult("version-2")).thenReturn(Mono.just(latest));
        when(benchmarkResultService.getHistory(PROMPT_ID, NOW, registryProperties.getBenchmark().getHistoryLimit()))
                .thenReturn(Flux.just(latest));
        when(qualityGateRuleProvider.getRules("qa")).thenReturn(Mono.error(
                new ResourceNotFoundException("No quality gate rules configured for environment: qa", ErrorCode.GATE_RULES_NOT_FOUND)));

        StepVerifier.create(rolloutDecisionService.checkReadiness(PROMPT_ID, "qa"))
                .expectErrorSatisfies(error -> assertEquals(ErrorCode.GATE_RULES_NOT_FOUND,
                        ((ResourceNotFoundException) error).getErrorCode()))
                .verify();
    }
}
