package org.lite.registry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality gate rules per deployment environment, in evaluation order:
 * <pre>
 * registry:
 *   quality-gates:
 *     environments:
 *       production:
 *         - id: score-minimum
 *           name: Minimum Score Threshold
 *           kind: minimum_score
 *           threshold: 80
 * </pre>
 * Definitions stay untyped here; they are checked when an evaluation asks for them.
 */
@ConfigurationProperties(prefix = "registry.quality-gates")
@Data
public class QualityGateProperties {

    private Map<String, List<RuleDefinition>> environments = new LinkedHashMap<>();

    public List<RuleDefinition> rulesFor(String environment) {
        return environments.getOrDefault(environment, new ArrayList<>());
    }

    @Data
    public static class RuleDefinition {
        private String id;
        private String name;
        private String kind;
        private boolean blocking = true;
        private Double threshold;       // minimum_score, dimension_floor
        private String dimension;       // dimension_floor
        private Double tolerance;       // no_regression
        private Long maxAgeHours;       // benchmark_freshness
    }
}
