package com.docprinter.printer;

/**
 * Resolved layout of a group.
 */
public enum PrintMode {
    BREAK,
    FLAT
}
