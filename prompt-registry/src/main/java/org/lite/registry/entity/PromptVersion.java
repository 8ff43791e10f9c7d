package org.lite.registry.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.registry.dto.DiffChunk;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("prompt_versions")
@CompoundIndexes({
    @CompoundIndex(name = "prompt_version_string_idx", def = "{'promptId': 1, 'versionString': 1}", unique = true),
    // Version history, newest first
    @CompoundIndex(name = "prompt_sequence_idx", def = "{'promptId': 1, 'sequence': -1}", unique = true)
})
public class PromptVersion {
    @Id
    private String id;
    private String promptId;                // Owning prompt

    // Version Information
    private String versionString;           // MAJOR.MINOR.PATCH
    private long sequence;                  // 1-based position in the prompt's history
    private String changeSummary;
    private String authorId;
    private Instant createdAt;

    // Snapshot
    private String content;
    private String contentHash;             // SHA-256 hex of content
    private List<DiffChunk> diffFromParent; // Null for the first version
}
