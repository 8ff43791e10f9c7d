package org.lite.registry.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class TrendPoint {
    private Instant executedAt;
    private double score;
    private String versionString;
    private String modelId;
}
