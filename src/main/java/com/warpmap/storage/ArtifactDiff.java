package com.warpmap.storage;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Compares a freshly rendered artifact with the copy already on disk.
 */
public class ArtifactDiff {

    private static final int CONTEXT_LINES = 3;

    private ArtifactDiff() {
    }

    /**
     * @return unified diff from the file on disk to {@code rendered}; empty when
     *         identical. A missing file diffs as empty.
     */
    public static String againstFile(Path existing, String rendered) throws IOException {
        List<String> original = Files.exists(existing)
            ? Files.readAllLines(existing, StandardCharsets.UTF_8)
            : Collections.emptyList();
        String name = existing.getFileName().toString();
        return unifiedDiff(name, original, toLines(rendered));
    }

    public static String unifiedDiff(String fileName, List<String> original, List<String> revised) {
        var patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
            "a/" + fileName,
            "b/" + fileName,
            original,
            patch,
            CONTEXT_LINES
        );
        return String.join("\n", unified);
    }

    static List<String> toLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String trimmed = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return Arrays.asList(trimmed.split("\n", -1));
    }
}
