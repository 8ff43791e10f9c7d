package service;

import org.junit.jupiter.api.Test;
import org.lite.registry.config.RegistryProperties;
import org.lite.registry.entity.PromptVersion;
import org.lite.registry.exception.ContentTooLargeException;
import org.lite.registry.service.ContentHasher;
import org.lite.registry.service.DiffEngine;
import org.lite.registry.service.UnifiedDiffRenderer;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class UnifiedDiffRendererTest {

    private final RegistryProperties registryProperties = new RegistryProperties();
    private final UnifiedDiffRenderer renderer = new UnifiedDiffRenderer(new DiffEngine(registryProperties));
    private final ContentHasher contentHasher = new ContentHasher();

    private PromptVersion version(String versionString, String content) {
        return PromptVersion.builder()
                .promptId("prompt-1")
                .versionString(versionString)
                .content(content)
                .contentHash(contentHasher.hash(content))
                .build();
    }

    private String render(String oldContent, String newContent, int contextLines) {
        return renderer.render(version("1.0.0", oldContent), version("1.0.1", newContent), contextLines);
    }

    @Test
    void testRender_SingleAddedLine() {
        assertEquals("--- 1.0.0\n+++ 1.0.1\n@@ -1,1 +1,2 @@\n A\n+B\n", render("A", "A\nB", 3));
    }

    @Test
    void testRender_IdenticalContentIsEmpty() {
        assertEquals("", render("A\nB", "A\nB", 3));
    }

    @Test
    void testRender_InsertIntoEmptyContent() {
        String text = render("", "A", 3);

        assertTrue(text.startsWith("--- 1.0.0\n+++ 1.0.1\n@@ -"), "Should carry both labels and a hunk header");
        assertTrue(text.endsWith("\n+A\n"));
        assertFalse(text.contains("\n-"), "Nothing can be removed from empty content");
    }

    @Test
    void testRender_ChangedLineIsRemovedThenAdded() {
        assertEquals("--- 1.0.0\n+++ 1.0.1\n@@ -1,3 +1,3 @@\n a\n-b\n+B\n c\n", render("a\nb\nc", "a\nB\nc", 3));
    }

    @Test
    void testRender_DistantChangesGetSeparateHunks() {
        // Given
        List<String> lines = IntStream.rangeClosed(1, 10).mapToObj(i -> "l" + i).collect(Collectors.toList());
        String oldContent = String.join("\n", lines);
        lines.set(1, "X");
        lines.set(8, "Y");
        String newContent = String.join("\n", lines);

        // When
        String text = render(oldContent, newContent, 1);

        // Then
        assertEquals("--- 1.0.0\n+++ 1.0.1\n"
                + "@@ -1,3 +1,3 @@\n l1\n-l2\n+X\n l3\n"
                + "@@ -8,3 +8,3 @@\n l8\n-l9\n+Y\n l10\n", text);
    }

    @Test
    void testRender_CloseChangesShareAHunk() {
        String text = render("a\nb\nc\nd\ne", "a\nB\nc\nD\ne", 3);

        assertEquals(1, text.split("@@ -", -1).length - 1, "Changes within the context window should be merged");
        assertTrue(text.startsWith("--- 1.0.0\n+++ 1.0.1\n@@ -1,5 +1,5 @@\n"));
    }

    @Test
    void testRender_RejectsNegativeContext() {
        assertThrows(IllegalArgumentException.class, () -> render("A", "B", -1));
    }

    @Test
    void testRender_RespectsLineLimit() {
        registryProperties.getDiff().setMaxLines(2);

        assertThrows(ContentTooLargeException.class, () -> render("a\nb\nc", "a", 3));
    }
}
