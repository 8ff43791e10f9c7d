package org.lite.registry.enums;

public enum DiffChunkKind {
    CONTEXT,    // Lines present in both contents
    ADD,        // Lines only in the new content
    REMOVE      // Lines only in the old content
}
