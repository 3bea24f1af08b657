package com.docprinter.config;

/**
 * Configuration for the formatting pipeline: layout constraints plus debug output switches.
 */
public class FormatterConfig {
    private final LayoutConfig layout;
    private final boolean includeDocTree;

    public FormatterConfig(LayoutConfig layout, boolean includeDocTree) {
        this.layout = layout;
        this.includeDocTree = includeDocTree;
    }

    public static FormatterConfig defaults() {
        return new FormatterConfig(LayoutConfig.defaults(), false);
    }

    public LayoutConfig getLayout() {
        return layout;
    }

    /**
     * Whether formatting results carry the serialized document.
     */
    public boolean isIncludeDocTree() {
        return includeDocTree;
    }

    public FormatterConfig withLayout(LayoutConfig layout) {
        return new FormatterConfig(layout, includeDocTree);
    }

    public FormatterConfig withIncludeDocTree(boolean includeDocTree) {
        return new FormatterConfig(layout, includeDocTree);
    }
}
