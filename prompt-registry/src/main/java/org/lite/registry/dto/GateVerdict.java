package org.lite.registry.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class GateVerdict {
    private boolean canDeploy;
    private List<GateEvaluation> evaluations;   // One per configured rule, in configuration order
    private List<String> blockers;
    private List<String> warnings;
    private String summary;
    private Instant evaluatedAt;

    // Stamped by the rollout check, absent when the evaluator is called directly
    private String promptId;
    private String versionString;
    private String environment;
}
