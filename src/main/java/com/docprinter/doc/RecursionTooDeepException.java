package com.docprinter.doc;

/**
 * Signals that a document is nested deeper than the configured ceiling. Thrown
 * while walking a document and converted into a typed failure at the API boundary.
 */
public class RecursionTooDeepException extends RuntimeException {
    private final int depth;
    private final int maxDepth;

    public RecursionTooDeepException(int depth, int maxDepth) {
        super("Document nesting depth " + depth + " exceeds the limit of " + maxDepth, null, false, false);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    /**
     * Throws if {@code depth} is beyond {@code maxDepth}.
     */
    public static int check(int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new RecursionTooDeepException(depth, maxDepth);
        }
        return depth;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
