package org.lite.registry.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("benchmark_results")
@CompoundIndexes({
    @CompoundIndex(name = "prompt_executed_idx", def = "{'promptId': 1, 'executedAt': -1}"),
    @CompoundIndex(name = "version_executed_idx", def = "{'versionId': 1, 'executedAt': -1}")
})
public class BenchmarkResult {
    @Id
    private String id;

    // References
    private String promptId;
    private String versionId;               // Version the run was executed against
    private String versionString;
    private String suiteId;

    // Scores
    private Map<String, Double> dimensionScores;
    private Map<String, Double> weights;
    private double overallScore;
    private Double baselineScore;
    private Double delta;                   // overallScore - baselineScore, absent without a baseline

    // Aggregator-level gate
    private double gateThreshold;
    private boolean gatePassed;

    // Execution context
    private String modelId;
    private String environment;
    private String executedBy;
    private Instant executedAt;
}
