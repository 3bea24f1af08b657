package com.docprinter.doc;

/**
 * How a {@link Line} renders in each mode.
 */
public enum LineKind {
    /** A space when flat, a newline when broken. */
    SOFT,
    /** Nothing when flat, a newline when broken. */
    SOFT_EMPTY,
    /** Always a newline; breaks every enclosing group. */
    HARD,
    /** Always a newline without indentation, for verbatim text. */
    LITERAL;

    public boolean isUnconditional() {
        return this == HARD || this == LITERAL;
    }
}
