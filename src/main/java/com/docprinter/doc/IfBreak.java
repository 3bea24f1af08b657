package com.docprinter.doc;

/**
 * Chooses between two documents based on the mode of the enclosing group, or of
 * the group identified by {@code groupId} when one is given.
 */
public record IfBreak(Doc breakContents, Doc flatContents, GroupId groupId) implements Doc {

    public IfBreak {
        if (breakContents == null || flatContents == null) {
            throw new IllegalArgumentException("IfBreak branches must not be null");
        }
    }

    @Override
    public DocKind kind() {
        return DocKind.IF_BREAK;
    }
}
