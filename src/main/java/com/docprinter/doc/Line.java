package com.docprinter.doc;

/**
 * A potential line break.
 */
public record Line(LineKind lineKind) implements Doc {

    public static final Line SOFT = new Line(LineKind.SOFT);
    public static final Line SOFT_EMPTY = new Line(LineKind.SOFT_EMPTY);
    public static final Line HARD = new Line(LineKind.HARD);
    public static final Line LITERAL = new Line(LineKind.LITERAL);

    public Line {
        if (lineKind == null) {
            throw new IllegalArgumentException("Line kind must not be null");
        }
    }

    public boolean isUnconditional() {
        return lineKind.isUnconditional();
    }

    @Override
    public DocKind kind() {
        return DocKind.LINE;
    }
}
