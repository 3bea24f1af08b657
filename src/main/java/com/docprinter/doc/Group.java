package com.docprinter.doc;

/**
 * The unit of fit-testing: {@code contents} is printed on one line when it fits,
 * otherwise every line in it (outside nested groups) breaks.
 *
 * @param contents    the grouped document
 * @param shouldBreak forces break mode regardless of width
 * @param id          optional identity other nodes may refer to, may be {@code null}
 */
public record Group(Doc contents, boolean shouldBreak, GroupId id) implements Doc {

    public Group {
        if (contents == null) {
            throw new IllegalArgumentException("Group contents must not be null");
        }
    }

    @Override
    public DocKind kind() {
        return DocKind.GROUP;
    }
}
