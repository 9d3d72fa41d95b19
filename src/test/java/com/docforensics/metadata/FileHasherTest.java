package com.docforensics.metadata;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileHasherTest {

    @TempDir
    Path tempDir;

    @Test
    void sha256MatchesKnownDigest() throws Exception {
        Path file = tempDir.resolve("abc.txt");
        Files.writeString(file, "abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", FileHasher.sha256(file));
    }

    @Test
    void missingFileFails() {
        assertThrows(java.io.IOException.class, () -> FileHasher.sha256(tempDir.resolve("missing")));
    }
}
