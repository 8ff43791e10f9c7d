package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.registry.config.RegistryProperties;
import org.lite.registry.dto.DiffChunk;
import org.lite.registry.enums.DiffChunkKind;
import org.lite.registry.exception.ContentTooLargeException;
import org.lite.registry.exception.DiffMismatchException;
import org.lite.registry.service.DiffEngine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffEngineTest {

    private RegistryProperties properties;
    private DiffEngine diffEngine;

    @BeforeEach
    void setUp() {
        properties = new RegistryProperties();
        diffEngine = new DiffEngine(properties);
    }

    @Test
    void testDiff_IdenticalContentHasNoChunks() {
        assertTrue(diffEngine.diff("A\nB", "A\nB").isEmpty());
        assertTrue(diffEngine.diff("", "").isEmpty());
    }

    @Test
    void testDiff_AppendedLine() {
        // When
        List<DiffChunk> chunks = diffEngine.diff("A", "A\nB");

        // Then
        assertEquals(2, chunks.size(), "Should have one context and one add chunk");
        DiffChunk context = chunks.get(0);
        assertEquals(DiffChunkKind.CONTEXT, context.getKind());
        assertEquals(List.of("A"), context.getLines());
        assertEquals(1, context.getOldStart());
        assertEquals(1, context.getNewStart());

        DiffChunk added = chunks.get(1);
        assertEquals(DiffChunkKind.ADD, added.getKind());
        assertEquals(List.of("B"), added.getLines());
        assertEquals(2, added.getNewStart(), "B is line 2 of the new content");
        assertEquals(1, added.getNewLineCount());
        assertEquals(0, added.getOldLineCount(), "An add chunk has no old lines");
    }

    @Test
    void testDiff_ReplacedLineIsRemoveThenAdd() {
        // When
        List<DiffChunk> chunks = diffEngine.diff("a\nb\nc", "a\nx\nc");

        // Then
        assertEquals(List.of(DiffChunkKind.CONTEXT, DiffChunkKind.REMOVE, DiffChunkKind.ADD, DiffChunkKind.CONTEXT),
                chunks.stream().map(DiffChunk::getKind).toList());
        assertEquals(List.of("b"), chunks.get(1).getLines());
        assertEquals(2, chunks.get(1).getOldStart());
        assertEquals(List.of("x"), chunks.get(2).getLines());
        assertEquals(2, chunks.get(2).getNewStart());
        assertEquals(3, chunks.get(3).getOldStart());
        assertEquals(3, chunks.get(3).getNewStart());
    }

    @Test
    void testDiff_FromAndToEmptyContent() {
        List<DiffChunk> added = diffEngine.diff("", "A\nB");
        assertEquals(1, added.size());
        assertEquals(DiffChunkKind.ADD, added.get(0).getKind());
        assertEquals(List.of("A", "B"), added.get(0).getLines());

        List<DiffChunk> removed = diffEngine.diff("A\nB", "");
        assertEquals(1, removed.size());
        assertEquals(DiffChunkKind.REMOVE, removed.get(0).getKind());
        assertEquals(List.of("A", "B"), removed.get(0).getLines());
    }

    @Test
    void testDiff_FindsShortestEditScript() {
        // Given - the classic example with an edit distance of 5
        String oldContent = String.join("\n", "A", "B", "C", "A", "B", "B", "A");
        String newContent = String.join("\n", "C", "B", "A", "B", "A", "C");

        // When
        List<DiffChunk> chunks = diffEngine.diff(oldContent, newContent);

        // Then
        int changedLines = chunks.stream()
                .filter(chunk -> chunk.getKind() != DiffChunkKind.CONTEXT)
                .mapToInt(chunk -> chunk.getLines().size())
                .sum();
        assertEquals(5, changedLines, "Three removals and two additions are enough");
        assertEquals(newContent, diffEngine.apply(oldContent, chunks));
    }

    @Test
    void testDiff_NoAdjacentChunksOfTheSameKind() {
        List<DiffChunk> chunks = diffEngine.diff("a\nb\nc\nd\ne\nf", "a\nB\nC\nd\nE\nf\ng");

        for (int i = 1; i < chunks.size(); i++) {
            assertNotEquals(chunks.get(i - 1).getKind(), chunks.get(i).getKind(),
                    "Runs of the same kind should be merged at index " + i);
            assertFalse(chunks.get(i - 1).getKind() == DiffChunkKind.ADD && chunks.get(i).getKind() == DiffChunkKind.REMOVE,
                    "A remove chunk should precede the add chunk of the same change");
        }
    }

    @Test
    void testApply_ReproducesNewContent() {
        String[][] pairs = {
                {"A", "A\nB"},
                {"A\nB", "A"},
                {"", "single"},
                {"single", ""},
                {"line\n", "line"},
                {"line", "line\n"},
                {"a\r\nb\r\n", "a\r\nc\r\n"},
                {"one\ntwo\nthree\nfour\nfive", "zero\none\nthree\nfour\nsix\nfive"},
                {"x\nx\nx\ny", "y\nx\nx\nx"},
                {"same\nsame\nsame", "same\nother\nsame\nsame"},
                {"\n\n\n", "\n"},
                {"alpha\nbeta\ngamma\ndelta", "delta\ngamma\nbeta\nalpha"},
                {"You are a helpful assistant.\nBe concise.\nCite sources.",
                        "You are a careful assistant.\nBe concise.\nAlways cite sources.\nNever guess."}
        };

        for (String[] pair : pairs) {
            List<DiffChunk> chunks = diffEngine.diff(pair[0], pair[1]);
            assertEquals(pair[1], diffEngine.apply(pair[0], chunks),
                    "Applying the diff should reproduce the new content for " + List.of(pair));
        }
    }

    @Test
    void testApply_RejectsDiffOfOtherContent() {
        List<DiffChunk> chunks = diffEngine.diff("A", "A\nB");

        assertThrows(DiffMismatchException.class, () -> diffEngine.apply("X", chunks));
        assertThrows(DiffMismatchException.class, () -> diffEngine.apply("A\nextra", chunks),
                "Old lines not covered by the diff should be rejected");
    }

    @Test
    void testDiff_RejectsContentOverLineLimit() {
        // Given
        properties.getDiff().setMaxLines(3);

        // When & Then
        assertThrows(ContentTooLargeException.class, () -> diffEngine.diff("a\nb", "a\nb\nc\nd"));
        assertDoesNotThrow(() -> diffEngine.diff("a\nb", "a\nb\nc"));
    }

    @Test
    void testDiff_RejectsNullContent() {
        assertThrows(IllegalArgumentException.class, () -> diffEngine.diff(null, "A"));
        assertThrows(IllegalArgumentException.class, () -> diffEngine.diff("A", null));
    }

    @Test
    void testSplitLines() {
        assertEquals(List.of(), DiffEngine.splitLines(""));
        assertEquals(List.of("A"), DiffEngine.splitLines("A"));
        assertEquals(List.of("A", ""), DiffEngine.splitLines("A\n"), "A trailing newline leaves an empty last line");
        assertEquals(List.of("A\r", "B"), DiffEngine.splitLines("A\r\nB"));
    }
}
