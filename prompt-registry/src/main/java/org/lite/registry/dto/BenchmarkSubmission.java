package org.lite.registry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A finished benchmark run as handed over by the benchmark execution service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BenchmarkSubmission {
    private String versionId;
    private String suiteId;
    private Map<String, Double> dimensionScores;
    private Map<String, Double> weights;        // Optional, uniform weighting when absent
    private Double baselineScore;               // Optional
    private Double gateThreshold;               // Optional, falls back to registry.benchmark.gate-threshold
    private String modelId;
    private String executedBy;
    private String environment;
    private Instant executedAt;                 // Optional, defaults to now
}
