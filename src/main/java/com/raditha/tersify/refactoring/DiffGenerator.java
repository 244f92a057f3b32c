package com.raditha.tersify.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for fix previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between a file on disk and its rewritten source.
     *
     * @param originalFile  Path to original file
     * @param rewrittenCode Rewritten code as string
     * @return Unified diff as string
     */
    public String generateUnifiedDiff(Path originalFile, String rewrittenCode) throws IOException {
        return generateUnifiedDiff(originalFile.getFileName().toString(), Files.readString(originalFile),
                rewrittenCode, DEFAULT_CONTEXT_LINES);
    }

    public String generateUnifiedDiff(String fileName, String originalCode, String rewrittenCode) {
        return generateUnifiedDiff(fileName, originalCode, rewrittenCode, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate a unified diff between two versions of a source text.
     */
    public String generateUnifiedDiff(String fileName, String originalCode, String rewrittenCode, int contextLines) {
        List<String> original = lines(originalCode);
        List<String> revised = lines(rewrittenCode);

        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                original,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String code) {
        return Arrays.asList(code.split("\r?\n", -1));
    }
}
