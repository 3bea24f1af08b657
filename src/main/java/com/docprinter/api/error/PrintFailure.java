package com.docprinter.api.error;

/**
 * Failures the printer reports to its caller instead of throwing.
 */
public enum PrintFailure {
    /** The document is nested deeper than the configured ceiling. */
    RECURSION_TOO_DEEP("Input is nested too deeply to format");

    private final String description;

    PrintFailure(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
