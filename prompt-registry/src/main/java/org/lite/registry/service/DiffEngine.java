package org.lite.registry.service;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.registry.config.RegistryProperties;
import org.lite.registry.dto.DiffChunk;
import org.lite.registry.enums.DiffChunkKind;
import org.lite.registry.exception.ContentTooLargeException;
import org.lite.registry.exception.DiffMismatchException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Line-oriented diff between two prompt contents.
 * <p>
 * Contents are split on {@code '\n'}; a trailing newline produces a final empty line, empty content has no
 * lines at all and {@code '\r'} stays part of its line, so {@link #apply} reproduces the new content byte for byte.
 * <p>
 * The edit script is the minimal one found by the Myers algorithm of java-diff-utils. Chunk boundaries are canonical:
 * the common prefix and suffix are always context, and every change region between two context runs becomes at most one {@code REMOVE} chunk followed by at most
 * one {@code ADD} chunk. The result is the full
 * aligned sequence; windowing context for display is left to {@link UnifiedDiffRenderer}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiffEngine {

    private final RegistryProperties properties;

    public List<DiffChunk> diff(String oldContent, String newContent) {
        if (oldContent == null || newContent == null) {
            throw new IllegalArgumentException("Diff contents cannot be null");
        }
        if (oldContent.equals(newContent)) {
            return List.of();
        }

        List<String> oldLines = splitLines(oldContent);
        List<String> newLines = splitLines(newContent);
        checkSize(oldLines, "old");
        checkSize(newLines, "new");

        int prefix = commonPrefix(oldLines, newLines);
        int suffix = commonSuffix(oldLines, newLines, prefix);
        Patch<String> patch = DiffUtils.diff(
                oldLines.subList(prefix, oldLines.size() - suffix),
                newLines.subList(prefix, newLines.size() - suffix));

        List<DiffChunk> chunks = toChunks(patch, prefix, oldLines, newLines);
        log.debug("Diffed {} -> {} lines into {} chunks", oldLines.size(), newLines.size(), chunks.size());
        return chunks;
    }

    /**
     * Applies a full chunk sequence produced by {@link #diff} to the old content.
     *
     * @throws DiffMismatchException if a context or remove chunk does not match the old content
     */
    public String apply(String oldContent, List<DiffChunk> chunks) {
        if (oldContent == null) {
            throw new IllegalArgumentException("Content cannot be null");
        }
        if (chunks == null || chunks.isEmpty()) {
            return oldContent;
        }

        List<String> oldLines = splitLines(oldContent);
        List<String> result = new ArrayList<>();
        int cursor = 0;

        for (DiffChunk chunk : chunks) {
            switch (chunk.getKind()) {
                case CONTEXT, REMOVE -> {
                    if (chunk.getOldStart() != cursor + 1) {
                        throw new DiffMismatchException(String.format(
                                "%s chunk starts at old line %d but line %d was expected",
                                chunk.getKind(), chunk.getOldStart(), cursor + 1));
                    }
                    for (String line : chunk.getLines()) {
                        if (cursor >= oldLines.size() || !oldLines.get(cursor).equals(line)) {
                            throw new DiffMismatchException("Old content differs from the diff at line " + (cursor + 1));
                        }
                        if (chunk.getKind() == DiffChunkKind.CONTEXT) {
                            result.add(line);
                        }
                        cursor++;
                    }
                }
                case ADD -> result.addAll(chunk.getLines());
            }
        }

        if (cursor != oldLines.size()) {
            throw new DiffMismatchException(String.format(
                    "Diff covers %d of %d old lines", cursor, oldLines.size()));
        }
        return String.join("\n", result);
    }

    public static List<String> splitLines(String content) {
        if (content.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(content.split("\n", -1));
    }

    void checkSize(List<String> lines, String side) {
        int maxLines = properties.getDiff().getMaxLines();
        if (lines.size() > maxLines) {
            throw new ContentTooLargeException(String.format(
                    "The %s content has %d lines, the diff limit is %d", side, lines.size(), maxLines));
        }
    }

    private static int commonPrefix(List<String> oldLines, List<String> newLines) {
        int max = Math.min(oldLines.size(), newLines.size());
        int prefix = 0;
        while (prefix < max && oldLines.get(prefix).equals(newLines.get(prefix))) {
            prefix++;
        }
        return prefix;
    }

    private static int commonSuffix(List<String> oldLines, List<String> newLines, int prefix) {
        int max = Math.min(oldLines.size(), newLines.size()) - prefix;
        int suffix = 0;
        while (suffix < max
                && oldLines.get(oldLines.size() - 1 - suffix).equals(newLines.get(newLines.size() - 1 - suffix))) {
            suffix++;
        }
        return suffix;
    }

    /**
     * @param offset lines trimmed before the patched range; delta positions are relative to it
     */
    private static List<DiffChunk> toChunks(Patch<String> patch, int offset, List<String> oldLines, List<String> newLines) {
        List<AbstractDelta<String>> deltas = new ArrayList<>(patch.getDeltas());
        deltas.sort(Comparator.comparingInt(delta -> delta.getSource().getPosition()));

        List<DiffChunk> chunks = new ArrayList<>();
        int oldIndex = 0;
        int newIndex = 0;
        int d = 0;

        while (d < deltas.size()) {
            int gap = deltas.get(d).getSource().getPosition() + offset - oldIndex;
            if (gap > 0) {
                chunks.add(chunk(DiffChunkKind.CONTEXT, oldIndex + 1, gap, newIndex + 1, gap,
                        oldLines.subList(oldIndex, oldIndex + gap)));
                oldIndex += gap;
                newIndex += gap;
            }

            // Deltas that touch each other form a single change region
            int oldStart = oldIndex;
            int newStart = newIndex;
            List<String> removed = new ArrayList<>();
            List<String> added = new ArrayList<>();
            while (d < deltas.size() && deltas.get(d).getSource().getPosition() + offset == oldIndex) {
                AbstractDelta<String> delta = deltas.get(d++);
                removed.addAll(delta.getSource().getLines());
                added.addAll(delta.getTarget().getLines());
                oldIndex += delta.getSource().size();
                newIndex += delta.getTarget().size();
            }
            if (!removed.isEmpty()) {
                chunks.add(chunk(DiffChunkKind.REMOVE, oldStart + 1, removed.size(), newStart + 1, 0, removed));
            }
            if (!added.isEmpty()) {
                chunks.add(chunk(DiffChunkKind.ADD, oldIndex + 1, 0, newStart + 1, added.size(), added));
            }
        }

        int tail = oldLines.size() - oldIndex;
        if (tail > 0) {
            chunks.add(chunk(DiffChunkKind.CONTEXT, oldIndex + 1, tail, newIndex + 1, tail,
                    oldLines.subList(oldIndex, oldLines.size())));
        }
        if (newIndex + tail != newLines.size()) {
            throw new IllegalStateException("Patch does not cover the new content");
        }
        return chunks;
    }

    private static DiffChunk chunk(DiffChunkKind kind, int oldStart, int oldLineCount,
                                   int newStart, int newLineCount, List<String> lines) {
        return DiffChunk.builder()
                .kind(kind)
                .oldStart(oldStart)
                .oldLineCount(oldLineCount)
                .newStart(newStart)
                .newLineCount(newLineCount)
                .lines(List.copyOf(lines))
                .build();
    }
}
