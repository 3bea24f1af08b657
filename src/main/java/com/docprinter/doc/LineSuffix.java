package com.docprinter.doc;

/**
 * Content deferred until just before the next emitted newline, such as a trailing comment.
 */
public record LineSuffix(Doc contents) implements Doc {

    public LineSuffix {
        if (contents == null) {
            throw new IllegalArgumentException("LineSuffix contents must not be null");
        }
    }

    @Override
    public DocKind kind() {
        return DocKind.LINE_SUFFIX;
    }
}
