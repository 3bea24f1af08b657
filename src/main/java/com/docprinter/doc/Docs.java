package com.docprinter.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Constructors for documents, for use by syntax-tree mappers.
 */
public final class Docs {
    public static final Doc EMPTY = new Text("");

    private Docs() {
    }

    public static Doc text(String value) {
        return value.isEmpty() ? EMPTY : new Text(value);
    }

    public static Doc concat(Doc... parts) {
        return concat(Arrays.asList(parts));
    }

    public static Doc concat(List<Doc> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Concat(parts);
    }

    /**
     * A space in flat mode, a newline in break mode.
     */
    public static Doc line() {
        return Line.SOFT;
    }

    /**
     * Nothing in flat mode, a newline in break mode.
     */
    public static Doc softLine() {
        return Line.SOFT_EMPTY;
    }

    public static Doc hardLine() {
        return Line.HARD;
    }

    public static Doc literalLine() {
        return Line.LITERAL;
    }

    public static Doc group(Doc... contents) {
        return new Group(concat(contents), false, null);
    }

    public static Doc group(Doc contents, boolean shouldBreak) {
        return new Group(contents, shouldBreak, null);
    }

    public static Doc groupWithId(GroupId id, Doc... contents) {
        return new Group(concat(contents), false, id);
    }

    public static Doc indent(Doc... contents) {
        return new Indent(concat(contents));
    }

    public static Doc ifBreak(Doc breakContents, Doc flatContents) {
        return new IfBreak(breakContents, flatContents, null);
    }

    public static Doc ifBreak(Doc breakContents, Doc flatContents, GroupId groupId) {
        return new IfBreak(breakContents, flatContents, groupId);
    }

    public static Doc lineSuffix(Doc contents) {
        return new LineSuffix(contents);
    }

    public static Doc lineSuffix(String contents) {
        return new LineSuffix(text(contents));
    }

    public static Doc breakParent() {
        return BreakParent.INSTANCE;
    }

    public static Doc fill(Doc... parts) {
        return new Fill(Arrays.asList(parts));
    }

    public static Doc fill(List<Doc> parts) {
        return new Fill(parts);
    }

    public static Doc trim() {
        return Trim.INSTANCE;
    }

    /**
     * Places {@code separator} between consecutive {@code docs}.
     */
    public static Doc join(Doc separator, List<Doc> docs) {
        List<Doc> parts = new ArrayList<>(Math.max(0, docs.size() * 2 - 1));
        for (int i = 0; i < docs.size(); i++) {
            if (i > 0) {
                parts.add(separator);
            }
            parts.add(docs.get(i));
        }
        return concat(parts);
    }

    /**
     * Builds a fill whose separators sit between consecutive {@code items}.
     */
    public static Doc fillJoin(Doc separator, List<Doc> items) {
        List<Doc> parts = new ArrayList<>(Math.max(0, items.size() * 2 - 1));
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                parts.add(separator);
            }
            parts.add(items.get(i));
        }
        return new Fill(parts);
    }
}
