package com.docprinter.config;

/**
 * Layout constraints for printing a document.
 */
public final class LayoutConfig {
    public static final int DEFAULT_MAX_WIDTH = 100;
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final int maxWidth;
    private final boolean useTabs;
    private final int tabWidth;
    private final EndOfLine endOfLine;
    private final int maxDepth;
    private final String indentUnit;

    private LayoutConfig(Builder builder) {
        this.maxWidth = builder.maxWidth;
        this.useTabs = builder.useTabs;
        this.tabWidth = builder.tabWidth;
        this.endOfLine = builder.endOfLine;
        this.maxDepth = builder.maxDepth;
        this.indentUnit = useTabs ? "\t" : " ".repeat(tabWidth);
    }

    public static LayoutConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxWidth(maxWidth)
                .useTabs(useTabs)
                .tabWidth(tabWidth)
                .endOfLine(endOfLine)
                .maxDepth(maxDepth);
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public boolean isUseTabs() {
        return useTabs;
    }

    /**
     * Columns per indentation level, whether it is written as a tab or as spaces.
     */
    public int getTabWidth() {
        return tabWidth;
    }

    public EndOfLine getEndOfLine() {
        return endOfLine;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Text written once per indentation level.
     */
    public String indentUnit() {
        return indentUnit;
    }

    public String lineEnding() {
        return endOfLine.getSequence();
    }

    @Override
    public String toString() {
        return "LayoutConfig{maxWidth=" + maxWidth + ", useTabs=" + useTabs + ", tabWidth=" + tabWidth
                + ", endOfLine=" + endOfLine + ", maxDepth=" + maxDepth + "}";
    }

    public static class Builder {
        private int maxWidth = DEFAULT_MAX_WIDTH;
        private boolean useTabs = false;
        private int tabWidth = DEFAULT_TAB_WIDTH;
        private EndOfLine endOfLine = EndOfLine.LF;
        private int maxDepth = DEFAULT_MAX_DEPTH;

        public Builder maxWidth(int maxWidth) {
            if (maxWidth < 1) {
                throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
            }
            this.maxWidth = maxWidth;
            return this;
        }

        public Builder useTabs(boolean useTabs) {
            this.useTabs = useTabs;
            return this;
        }

        public Builder tabWidth(int tabWidth) {
            if (tabWidth < 1) {
                throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
            }
            this.tabWidth = tabWidth;
            return this;
        }

        public Builder endOfLine(EndOfLine endOfLine) {
            if (endOfLine == null) {
                throw new IllegalArgumentException("endOfLine must not be null");
            }
            this.endOfLine = endOfLine;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public LayoutConfig build() {
            return new LayoutConfig(this);
        }
    }
}
