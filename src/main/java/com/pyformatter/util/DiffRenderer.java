package com.pyformatter.util;

import java.util.Arrays;
import java.util.List;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

/**
 * Renders unified diffs between two texts.
 */
public final class DiffRenderer {
    private static final int CONTEXT_LINES = 5;

    private DiffRenderer() {
    }

    /**
     * A unified diff with {@code --- fromName} and {@code +++ toName} headers, or an empty string
     * when the texts are equal.
     */
    public static String unifiedDiff(String from, String to, String fromName, String toName) {
        if (from.equals(to)) {
            return "";
        }
        List<String> original = splitLines(from);
        List<String> revised = splitLines(to);
        Patch<String> patch = DiffUtils.diff(original, revised);
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(fromName, toName, original, patch, CONTEXT_LINES);
        return String.join("\n", diff) + "\n";
    }

    private static List<String> splitLines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return Arrays.asList(body.split("\n", -1));
    }
}
