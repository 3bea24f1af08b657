package com.docprinter.doc;

import java.util.List;

/**
 * Alternating content and separator parts, starting with content. Each separator
 * breaks only when the content after it would not fit on the current line.
 */
public record Fill(List<Doc> parts) implements Doc {

    public Fill {
        parts = List.copyOf(parts);
    }

    @Override
    public DocKind kind() {
        return DocKind.FILL;
    }
}
