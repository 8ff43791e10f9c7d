package org.lite.registry.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.registry.enums.PromptStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("prompts")
public class Prompt {
    @Id
    private String id;

    @Indexed(unique = true)
    private String slug;                    // Human-readable unique key
    private String name;
    private String description;

    // Lifecycle
    private PromptStatus status;
    private String statusVersion;           // Version the current status refers to

    // Head pointer, only ever moved by a compare-and-swap on headVersion
    private String headVersion;             // Null until the first version is written
    private long headSequence;              // 0 until the first version is written

    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;

    public boolean hasVersions() {
        return headVersion != null;
    }
}
