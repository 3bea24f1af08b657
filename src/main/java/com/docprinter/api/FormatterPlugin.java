package com.docprinter.api;

import com.docprinter.doc.Doc;

/**
 * Language support plugged into the formatting pipeline: a front-end that parses
 * source text and a mapper that turns the resulting syntax tree into a document.
 *
 * @param <T> the syntax tree type
 */
public interface FormatterPlugin<T> {
    /**
     * Parses source code, reporting problems as diagnostics rather than exceptions.
     */
    ParsedSource<T> parse(String sourceCode);

    /**
     * Maps a successfully parsed tree to the document describing its layout.
     */
    Doc toDoc(T tree);
}
