package com.docprinter.api.error;

/**
 * A diagnostic attached to a formatting result, positioned in the source text.
 * Lines and columns are 1-based; 0 means the position is unknown.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    /**
     * A diagnostic about the whole document rather than a position in it.
     */
    public static FormatterError ofDocument(Severity severity, String message) {
        return new FormatterError(severity, message, 0, 0);
    }

    public boolean isBlocking() {
        return severity == Severity.FATAL || severity == Severity.ERROR;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return severity + ": " + message + " (" + line + ":" + column + ")";
    }
}
