package com.pyformatter.util;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.pyformatter.api.error.FormatterError;
import com.pyformatter.api.error.Severity;

/**
 * Renders formatter errors for humans, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * Creates a new error formatter.
     *
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one error as {@code SEVERITY [category]: message (line:column)}.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr);
        if (error.getCategory() != null) {
            sb.append(" [").append(error.getCategory().name().toLowerCase()).append("]");
        }
        sb.append(": ").append(error.getMessage());
        if (error.getLine() > 0) {
            sb.append(" (").append(error.getLine()).append(":").append(error.getColumn()).append(")");
        }

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Formats an error followed by its diagnostic dump, when it carries one.
     */
    public String formatDetailed(FormatterError error) {
        String text = formatError(error);
        if (error.getDiagnostic() == null || error.getDiagnostic().isEmpty()) {
            return text;
        }
        return text + "\n" + colorize(ANSI_BOLD, "Diagnostic:") + "\n" + error.getDiagnostic();
    }

    /**
     * Creates a summary of errors per formatting unit.
     */
    public String formatErrorSummary(Map<String, List<FormatterError>> unitErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        int totalFatals = 0;
        int totalErrors = 0;
        int totalWarnings = 0;

        for (Map.Entry<String, List<FormatterError>> entry : unitErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, List<FormatterError>> bySeverity = groupBySeverity(errors);
            int fatals = bySeverity.getOrDefault(Severity.FATAL, List.of()).size();
            int errs = bySeverity.getOrDefault(Severity.ERROR, List.of()).size();
            int warnings = bySeverity.getOrDefault(Severity.WARNING, List.of()).size();
            totalFatals += fatals;
            totalErrors += errs;
            totalWarnings += warnings;

            sb.append(entry.getKey()).append(": ").append(countsLine(fatals, errs, warnings)).append("\n");
        }

        sb.append("\nTotal: ").append(countsLine(totalFatals, totalErrors, totalWarnings));
        return sb.toString();
    }

    private String countsLine(int fatals, int errors, int warnings) {
        StringBuilder sb = new StringBuilder();
        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal")).append(", ");
        }
        if (errors > 0) {
            sb.append(colorize(ANSI_RED, errors + " errors")).append(", ");
        }
        if (warnings > 0) {
            sb.append(colorize(ANSI_YELLOW, warnings + " warnings")).append(", ");
        }
        if (sb.length() == 0) {
            return "no errors";
        }
        sb.setLength(sb.length() - 2);
        return sb.toString();
    }

    /**
     * Groups errors by severity.
     */
    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FormatterError::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
