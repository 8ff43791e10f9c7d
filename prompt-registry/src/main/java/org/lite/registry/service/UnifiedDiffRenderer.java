package org.lite.registry.service;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.entity.PromptVersion;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Renders the change between two prompt versions as unified diff text, keeping {@code contextLines} of context
 * around each change. Lines follow {@link DiffEngine#splitLines}, and the version strings label both sides.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnifiedDiffRenderer {

    private final DiffEngine diffEngine;

    public String render(PromptVersion from, PromptVersion to, int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("Context lines cannot be negative");
        }
        if (from.getContentHash() != null && from.getContentHash().equals(to.getContentHash())) {
            return "";
        }

        List<String> oldLines = DiffEngine.splitLines(from.getContent());
        List<String> newLines = DiffEngine.splitLines(to.getContent());
        diffEngine.checkSize(oldLines, "old");
        diffEngine.checkSize(newLines, "new");

        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                from.getVersionString(), to.getVersionString(), oldLines, patch, contextLines);

        log.debug("Rendered {} changes between {} and {}", patch.getDeltas().size(), from.getVersionString(), to.getVersionString());
        return String.join("\n", unified) + "\n";
    }
}
