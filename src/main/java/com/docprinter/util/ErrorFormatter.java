package com.docprinter.util;

import com.docprinter.api.FormatterResult;
import com.docprinter.api.error.FormatterError;

/**
 * Renders diagnostics and formatting outcomes as one-line messages, optionally with ANSI colors.
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
     * @param useColors whether to wrap severities in ANSI colors
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        if (error.getLine() > 0) {
            sb.append(" (Line ").append(error.getLine());
            if (error.getColumn() > 0) {
                sb.append(", Column ").append(error.getColumn());
            }
            sb.append(")");
        }

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Summarizes a result: its failure message if any, then each diagnostic on its own line.
     */
    public String formatResult(String name, FormatterResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, name)).append(": ");
        sb.append(result.isSuccessful() ? colorize(ANSI_GREEN, "formatted") : colorize(ANSI_RED, "not formatted"));

        if (!result.getFailureMessage().isEmpty()) {
            sb.append(" - ").append(result.getFailureMessage());
        }
        for (FormatterError error : result.getErrors()) {
            sb.append("\n  ").append(formatError(error));
        }
        return sb.toString();
    }

    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
