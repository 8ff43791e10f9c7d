package org.lite.registry.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.lite.registry.exception.ContentEncodingException;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Content fingerprints for prompt versions: lowercase hex SHA-256 of the UTF-8 bytes.
 */
@Service
@Slf4j
public class ContentHasher {

    public String hash(String content) {
        if (content == null) {
            throw new ContentEncodingException("Content must not be null");
        }
        return DigestUtils.sha256Hex(encode(content));
    }

    /**
     * Recomputes the fingerprint of {@code content} and compares it with {@code expectedHash}.
     */
    public boolean matches(String content, String expectedHash) {
        return expectedHash != null && expectedHash.equals(hash(content));
    }

    private byte[] encode(String content) {
        // String.getBytes would silently replace unpaired surrogates with '?'
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(content));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            log.warn("Rejecting content that cannot be encoded as UTF-8: {}", e.getMessage());
            throw new ContentEncodingException("Content is not valid UTF-8 text", e);
        }
    }
}
