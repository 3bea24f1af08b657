package com.docprinter.doc;

/**
 * Tag for each {@link Doc} variant, used for dispatch in the printer and serializer.
 */
public enum DocKind {
    TEXT("text"),
    CONCAT("concat"),
    LINE("line"),
    GROUP("group"),
    INDENT("indent"),
    IF_BREAK("ifBreak"),
    LINE_SUFFIX("lineSuffix"),
    BREAK_PARENT("breakParent"),
    FILL("fill"),
    TRIM("trim");

    private final String tag;

    DocKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static DocKind fromTag(String tag) {
        for (DocKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown document kind: " + tag);
    }
}
