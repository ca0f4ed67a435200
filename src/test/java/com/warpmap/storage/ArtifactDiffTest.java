package com.warpmap.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactDiffTest {

    @Test
    void identicalContentHasNoDiff(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("map_info.json");
        Files.writeString(file, "{\n  \"a\" : 1\n}\n");

        assertEquals("", ArtifactDiff.againstFile(file, "{\n  \"a\" : 1\n}\n"));
    }

    @Test
    void changedLineShowsInUnifiedDiff(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("transitions_weak.json");
        Files.writeString(file, "{\n  \"[0]-[1]\" : \"warp\"\n}\n");

        String diff = ArtifactDiff.againstFile(file, "{\n  \"[0]-[1]\" : \"overworld\"\n}\n");

        assertTrue(diff.startsWith("--- a/transitions_weak.json"));
        assertTrue(diff.contains("-  \"[0]-[1]\" : \"warp\""));
        assertTrue(diff.contains("+  \"[0]-[1]\" : \"overworld\""));
    }

    @Test
    void missingFileDiffsAsEmpty(@TempDir Path tempDir) throws IOException {
        String diff = ArtifactDiff.againstFile(tempDir.resolve("absent.json"), "{ }\n");

        assertTrue(diff.contains("+{ }"));
    }

    @Test
    void splitsRenderedTextOnNewlines() {
        assertEquals(List.of("{", "}"), ArtifactDiff.toLines("{\n}\n"));
        assertTrue(ArtifactDiff.toLines("").isEmpty());
    }
}
