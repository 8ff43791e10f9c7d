package org.lite.registry.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "registry")
@Validated
@Data
public class RegistryProperties {

    @Valid
    private Versioning versioning = new Versioning();
    @Valid
    private Diff diff = new Diff();
    @Valid
    private Benchmark benchmark = new Benchmark();

    @Data
    public static class Versioning {
        @NotBlank(message = "Initial version is required")
        private String initialVersion = "1.0.0";
        @Min(value = 1, message = "At least one head update attempt is required")
        private int maxHeadUpdateAttempts = 5;  // CAS re-reads before giving up with a conflict
    }

    @Data
    public static class Diff {
        @Min(value = 1, message = "maxLines must be at least 1")
        private int maxLines = 10_000;          // Per side
        @Min(value = 0, message = "contextLines cannot be negative")
        private int contextLines = 3;           // Window used when rendering unified text
    }

    @Data
    public static class Benchmark {
        @DecimalMin(value = "0.0", message = "Gate threshold must be within [0, 100]")
        @DecimalMax(value = "100.0", message = "Gate threshold must be within [0, 100]")
        private double gateThreshold = 80.0;
        @Min(value = 1, message = "historyLimit must be at least 1")
        private int historyLimit = 20;          // Results handed to the gate evaluator
    }
}
