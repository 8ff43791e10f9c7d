package org.lite.registry.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScoreAggregate {
    private double overallScore;
    private Double delta;           // Absent when no baseline was supplied
    private double gateThreshold;
    private boolean gatePassed;
}
