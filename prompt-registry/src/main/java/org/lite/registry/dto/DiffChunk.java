package org.lite.registry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.registry.enums.DiffChunkKind;

import java.util.List;

/**
 * A run of lines of a single kind. Line numbers are 1-based; a chunk that only exists on one side
 * carries a zero count for the other side, with its start pointing at the position of the run there.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffChunk {
    private DiffChunkKind kind;
    private int oldStart;
    private int oldLineCount;
    private int newStart;
    private int newLineCount;
    private List<String> lines;
}
