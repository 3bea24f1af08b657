package com.docprinter.core;

import java.util.logging.Logger;

import com.docprinter.api.DocumentPrinter;
import com.docprinter.api.PrintResult;
import com.docprinter.api.error.PrintFailure;
import com.docprinter.config.LayoutConfig;
import com.docprinter.doc.Doc;
import com.docprinter.doc.RecursionTooDeepException;
import com.docprinter.printer.DocPrinter;
import com.docprinter.util.LoggerUtil;

/**
 * Default {@link DocumentPrinter}: runs {@link DocPrinter} and turns a depth
 * overflow into a failed result. Stateless and safe to share between threads.
 */
public class LayoutPrinter implements DocumentPrinter {
    private static final Logger logger = LoggerUtil.getLogger(LayoutPrinter.class);

    @Override
    public PrintResult print(Doc document, LayoutConfig config, int startColumn) {
        try {
            return PrintResult.success(DocPrinter.print(document, config, startColumn));
        } catch (RecursionTooDeepException e) {
            logger.warning("Giving up on document: " + e.getMessage());
            return PrintResult.failure(
                    PrintFailure.RECURSION_TOO_DEEP,
                    PrintFailure.RECURSION_TOO_DEEP.getDescription());
        }
    }
}
