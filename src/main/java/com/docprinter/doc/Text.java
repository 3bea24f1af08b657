package com.docprinter.doc;

/**
 * Literal characters, printed as-is.
 */
public record Text(String value) implements Doc {

    public Text {
        if (value == null) {
            throw new IllegalArgumentException("Text value must not be null");
        }
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Text must not contain a line break: " + value);
        }
    }

    @Override
    public DocKind kind() {
        return DocKind.TEXT;
    }
}
