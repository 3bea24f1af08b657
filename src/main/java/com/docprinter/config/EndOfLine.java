package com.docprinter.config;

/**
 * Newline sequence written for every emitted line break.
 */
public enum EndOfLine {
    LF("\n"),
    CRLF("\r\n");

    private final String sequence;

    EndOfLine(String sequence) {
        this.sequence = sequence;
    }

    public String getSequence() {
        return sequence;
    }

    /**
     * Parses {@code lf} or {@code crlf}, case-insensitively.
     */
    public static EndOfLine fromName(String name) {
        for (EndOfLine endOfLine : values()) {
            if (endOfLine.name().equalsIgnoreCase(name)) {
                return endOfLine;
            }
        }
        throw new IllegalArgumentException("Unknown end of line: " + name);
    }
}
