package com.docprinter.doc;

import java.util.List;

/**
 * Ordered juxtaposition of documents.
 */
public record Concat(List<Doc> parts) implements Doc {

    public Concat {
        parts = List.copyOf(parts);
    }

    @Override
    public DocKind kind() {
        return DocKind.CONCAT;
    }
}
