package com.docprinter.doc;

/**
 * Formatting intent produced by a syntax-tree mapper and consumed by the printer.
 *
 * <p>The set of variants is closed. Documents are immutable values: the printer
 * only reads them and keeps its own render state, so a single document may be
 * printed concurrently from several threads.
 */
public sealed interface Doc
        permits Text, Concat, Line, Group, Indent, IfBreak, LineSuffix, BreakParent, Fill, Trim {

    DocKind kind();
}
