package com.docprinter.api;

import com.docprinter.api.error.FormatterError;

import java.util.List;

/**
 * What a front-end hands back after parsing: the syntax tree and its diagnostics.
 *
 * @param tree        the root of the syntax tree, may be {@code null} if parsing gave up
 * @param diagnostics problems found while parsing, in source order
 */
public record ParsedSource<T>(T tree, List<FormatterError> diagnostics) {

    public ParsedSource {
        diagnostics = List.copyOf(diagnostics);
    }

    public static <T> ParsedSource<T> of(T tree) {
        return new ParsedSource<>(tree, List.of());
    }

    public boolean hasErrors() {
        return tree == null || diagnostics.stream().anyMatch(FormatterError::isBlocking);
    }
}
