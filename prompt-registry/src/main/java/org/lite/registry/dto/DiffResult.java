package org.lite.registry.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DiffResult {
    private String promptId;
    private String fromVersion;
    private String toVersion;
    private String fromContentHash;
    private String toContentHash;
    private List<DiffChunk> chunks;

    public boolean isIdentical() {
        return chunks == null || chunks.isEmpty();
    }
}
