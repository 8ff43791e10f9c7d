package org.lite.registry.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class BenchmarkTrends {
    private String promptId;
    private int days;                       // Window the trend points were taken from
    private List<TrendPoint> trendData;     // Oldest first

    // Averages and deltas are absent when their window holds no results
    private Double rollingAverage7d;
    private Double rollingAverage30d;
    private Double scoreDelta7d;            // 7-day average minus the average of the last runs before it
    private Double scoreDelta30d;

    private boolean regressing;
    private String regressionAlert;
}
