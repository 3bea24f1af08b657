package com.docprinter.doc;

/**
 * Increases the indentation of {@code contents} by one unit.
 */
public record Indent(Doc contents) implements Doc {

    public Indent {
        if (contents == null) {
            throw new IllegalArgumentException("Indent contents must not be null");
        }
    }

    @Override
    public DocKind kind() {
        return DocKind.INDENT;
    }
}
