package com.pyformatter.api.error;

/**
 * Represents an error found during formatting.
 */
public class FormatterError {
    private final Severity severity;
    private final ErrorCategory category;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;
    private final String diagnostic;

    public FormatterError(Severity severity, ErrorCategory category, String message, int line, int column) {
        this(severity, category, message, line, column, null, null);
    }

    public FormatterError(Severity severity, ErrorCategory category, String message, int line, int column,
                          String suggestion, String diagnostic) {
        this.severity = severity;
        this.category = category;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
        this.diagnostic = diagnostic;
    }

    /**
     * Converts a formatter exception into a fatal error entry.
     */
    public static FormatterError fromException(FormatterException e) {
        String suggestion = switch (e.getCategory()) {
            case SYNTAX -> "Fix the syntax error or select the matching target versions";
            case UNSUPPORTED -> "Add a newer target version or remove the construct";
            case INTERNAL -> "Report the diagnostic dump; the source was left unchanged";
            case IO -> null;
        };
        String diagnostic = e instanceof InternalFormatterException
                ? ((InternalFormatterException) e).getDiagnostic()
                : null;
        return new FormatterError(Severity.FATAL, e.getCategory(), e.getMessage(),
                e.getLine(), e.getColumn(), suggestion, diagnostic);
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public ErrorCategory getCategory() { return category; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }
    public String getDiagnostic() { return diagnostic; }
}
