package service;

import org.junit.jupiter.api.Test;
import org.lite.registry.exception.ContentEncodingException;
import org.lite.registry.service.ContentHasher;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherTest {

    private final ContentHasher contentHasher = new ContentHasher();

    @Test
    void testHash_KnownDigests() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", contentHasher.hash(""),
                "Empty content should hash to the SHA-256 of no bytes");
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", contentHasher.hash("abc"));
    }

    @Test
    void testHash_IsDeterministicAndSensitiveToWhitespace() {
        // Given
        String content = "You are a helpful assistant.\nAnswer briefly.";

        // When
        String first = contentHasher.hash(content);
        String second = contentHasher.hash(content);

        // Then
        assertEquals(first, second, "Equal content must produce an equal fingerprint");
        assertEquals(64, first.length(), "Fingerprint should be 64 hex characters");
        assertTrue(first.matches("[0-9a-f]+"), "Fingerprint should be lowercase hex");
        assertNotEquals(first, contentHasher.hash(content + "\n"), "A trailing newline is a different content");
        assertNotEquals(first, contentHasher.hash(content.replace("\n", "\r\n")), "Line endings are part of the content");
    }

    @Test
    void testHash_HashesUtf8Bytes() {
        assertNotEquals(contentHasher.hash("cafe"), contentHasher.hash("café"));
        assertNotEquals(contentHasher.hash("caf\u00e9"), contentHasher.hash("cafe\u0301"),
                "Content is hashed as given, without Unicode normalization");
    }

    @Test
    void testHash_RejectsInvalidContent() {
        assertThrows(ContentEncodingException.class, () -> contentHasher.hash(null));
        assertThrows(ContentEncodingException.class, () -> contentHasher.hash("broken \uD800 surrogate"),
                "An unpaired surrogate has no UTF-8 encoding");
    }

    @Test
    void testMatches() {
        String hash = contentHasher.hash("A");

        assertTrue(contentHasher.matches("A", hash));
        assertFalse(contentHasher.matches("B", hash));
        assertFalse(contentHasher.matches("A", null));
    }
}
