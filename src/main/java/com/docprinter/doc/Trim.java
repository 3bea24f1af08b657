package com.docprinter.doc;

/**
 * Removes trailing spaces and tabs already written on the current line.
 */
public record Trim() implements Doc {

    public static final Trim INSTANCE = new Trim();

    @Override
    public DocKind kind() {
        return DocKind.TRIM;
    }
}
