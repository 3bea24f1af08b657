package com.docprinter.printer;

import com.docprinter.config.LayoutConfig;

/**
 * One level of the indentation stack: the prefix written after each newline and
 * its width in columns. Popping a level happens implicitly once no pending
 * command refers to it.
 */
record Indentation(String value, int width) {

    static final Indentation ROOT = new Indentation("", 0);

    Indentation increase(LayoutConfig config) {
        return new Indentation(value + config.indentUnit(), width + config.getTabWidth());
    }
}
