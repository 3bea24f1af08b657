package com.docprinter.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.docprinter.api.FormatterResult;
import com.docprinter.api.error.FormatterError;
import com.docprinter.api.error.Severity;
import org.junit.jupiter.api.Test;

class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void showsPositionOnlyWhenKnown() {
        assertThat(plain.formatError(new FormatterError(Severity.ERROR, "Unexpected ')'", 3, 7)))
                .isEqualTo("ERROR: Unexpected ')' (Line 3, Column 7)");
        assertThat(plain.formatError(FormatterError.ofDocument(Severity.FATAL, "Input is nested too deeply to format")))
                .isEqualTo("FATAL: Input is nested too deeply to format");
    }

    @Test
    void appendsSuggestion() {
        FormatterError error = new FormatterError(Severity.WARNING, "Missing ')'", 1, 0, "Close every list");

        assertThat(plain.formatError(error)).isEqualTo("WARNING: Missing ')' (Line 1)\n  Suggestion: Close every list");
    }

    @Test
    void colorsOnlyWhenEnabled() {
        ErrorFormatter colored = new ErrorFormatter(true);

        assertThat(colored.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("\u001B[31mx\u001B[0m");
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
    }

    @Test
    void summarizesFailedResult() {
        FormatterResult result = FormatterResult.builder()
                .successful(false)
                .formattedCode("(")
                .failureMessage("Cancelled")
                .addError(FormatterError.ofDocument(Severity.INFO, "Cancelled"))
                .build();

        assertThat(plain.formatResult("a.lisp", result))
                .isEqualTo("a.lisp: not formatted - Cancelled\n  INFO: Cancelled");
    }

    @Test
    void summarizesSuccessfulResult() {
        FormatterResult result = FormatterResult.builder().successful(true).formattedCode("(a)\n").build();

        assertThat(plain.formatResult("a.lisp", result)).isEqualTo("a.lisp: formatted");
    }
}
