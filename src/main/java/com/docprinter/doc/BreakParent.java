package com.docprinter.doc;

/**
 * Forces every enclosing group into break mode.
 */
public record BreakParent() implements Doc {

    public static final BreakParent INSTANCE = new BreakParent();

    @Override
    public DocKind kind() {
        return DocKind.BREAK_PARENT;
    }
}
