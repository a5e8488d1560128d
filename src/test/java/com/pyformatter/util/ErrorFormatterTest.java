package com.pyformatter.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.pyformatter.api.error.ErrorCategory;
import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;

class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void formatsSeverityCategoryAndPosition() {
        FormatterError error = new FormatterError(Severity.FATAL, ErrorCategory.SYNTAX,
                "Cannot parse", 3, 7);

        assertEquals("FATAL [syntax]: Cannot parse (3:7)", plain.formatError(error));
    }

    @Test
    void omitsPositionWhenUnknown() {
        FormatterError error = new FormatterError(Severity.WARNING, ErrorCategory.IO, "Cache unreadable", 0, 0);

        assertEquals("WARNING [io]: Cache unreadable", plain.formatError(error));
    }

    @Test
    void appendsSuggestionAndDiagnostic() {
        FormatterError error = new FormatterError(Severity.FATAL, ErrorCategory.INTERNAL,
                "Output differs", 0, 0, "Report it", "--- src\n+++ dst");

        String text = plain.formatDetailed(error);

        assertEquals("FATAL [internal]: Output differs\n  Suggestion: Report it\nDiagnostic:\n--- src\n+++ dst",
                text);
    }

    @Test
    void colorsOnlyWhenEnabled() {
        ErrorFormatter colored = new ErrorFormatter(true);

        assertEquals(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET,
                colored.colorize(ErrorFormatter.ANSI_RED, "x"));
        assertEquals("x", plain.colorize(ErrorFormatter.ANSI_RED, "x"));
    }

    @Test
    void summaryCountsPerUnitAndTotal() {
        Map<String, List<FormatterError>> unitErrors = new LinkedHashMap<>();
        unitErrors.put("a.py", List.of(
                new FormatterError(Severity.FATAL, ErrorCategory.SYNTAX, "bad", 1, 0),
                new FormatterError(Severity.WARNING, ErrorCategory.IO, "meh", 0, 0)));
        unitErrors.put("b.py", List.of(
                new FormatterError(Severity.ERROR, ErrorCategory.UNSUPPORTED, "walrus", 2, 4)));
        unitErrors.put("c.py", List.of());

        String summary = plain.formatErrorSummary(unitErrors);

        assertTrue(summary.startsWith("Error Summary:\n"), summary);
        assertTrue(summary.contains("a.py: 1 fatal, 1 warnings\n"), summary);
        assertTrue(summary.contains("b.py: 1 errors\n"), summary);
        assertTrue(summary.endsWith("Total: 1 fatal, 1 errors, 1 warnings"), summary);
    }
}
