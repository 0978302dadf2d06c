package com.williamcallahan.actdb.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/**
 * Verifies digest formatting in {@link ContentHasher}.
 */
class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void sha256_matchesKnownDigest() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                hasher.sha256("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void storageKey_splitsDigestIntoDirectoryAndName() {
        assertEquals("act/ba/7816bf8f01cfea",
                hasher.storageKey("act", "abc".getBytes(StandardCharsets.UTF_8)));
    }
}
