package com.docprinter.api;

import java.util.ArrayList;
import java.util.List;

import com.docprinter.api.error.FormatterError;

/**
 * Result of formatting one source text. When unsuccessful, {@code formattedCode}
 * is the original text, untouched.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final String docTree;
    private final String failureMessage;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.errors = List.copyOf(builder.errors);
        this.docTree = builder.docTree;
        this.failureMessage = builder.failureMessage;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * The serialized document, or an empty string unless it was requested.
     */
    public String getDocTree() {
        return docTree;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private String docTree = "";
        private String failureMessage = "";

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder docTree(String docTree) {
            this.docTree = docTree;
            return this;
        }

        public Builder failureMessage(String failureMessage) {
            this.failureMessage = failureMessage;
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
