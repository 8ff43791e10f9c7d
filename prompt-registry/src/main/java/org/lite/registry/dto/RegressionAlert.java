package org.lite.registry.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RegressionAlert {
    private String promptId;
    private String slug;
    private String alert;
    private Double rollingAverage7d;
    private Double scoreDelta7d;
}
