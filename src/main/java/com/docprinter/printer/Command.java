package com.docprinter.printer;

import com.docprinter.doc.Doc;
import com.docprinter.doc.RecursionTooDeepException;

/**
 * Unit of work on the printer's stack.
 *
 * @param fillOffset index of the first unprinted part when {@code doc} is a fill
 */
record Command(Indentation indentation, PrintMode mode, Doc doc, int depth, int fillOffset) {

    Command(Indentation indentation, PrintMode mode, Doc doc, int depth) {
        this(indentation, mode, doc, depth, 0);
    }

    Command child(Doc contents, int maxDepth) {
        return child(mode, contents, maxDepth);
    }

    Command child(PrintMode childMode, Doc contents, int maxDepth) {
        return new Command(indentation, childMode, contents, RecursionTooDeepException.check(depth + 1, maxDepth));
    }
}
