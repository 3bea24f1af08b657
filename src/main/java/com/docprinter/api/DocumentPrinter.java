package com.docprinter.api;

import com.docprinter.config.LayoutConfig;
import com.docprinter.doc.Doc;

/**
 * Renders documents to text. Printing is all-or-nothing: a failed result carries no text.
 */
public interface DocumentPrinter {

    default PrintResult print(Doc document, LayoutConfig config) {
        return print(document, config, 0);
    }

    PrintResult print(Doc document, LayoutConfig config, int startColumn);
}
