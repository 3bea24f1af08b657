package com.docprinter.api;

import com.docprinter.api.error.PrintFailure;

/**
 * Outcome of printing one document.
 */
public class PrintResult {
    private final boolean successful;
    private final String text;
    private final PrintFailure failure;
    private final String failureMessage;

    private PrintResult(Builder builder) {
        this.successful = builder.failure == null;
        this.text = builder.text;
        this.failure = builder.failure;
        this.failureMessage = builder.failureMessage;
    }

    public static PrintResult success(String text) {
        return builder().text(text).build();
    }

    public static PrintResult failure(PrintFailure failure, String message) {
        return builder().failure(failure).failureMessage(message).build();
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * The printed text, or {@code null} when printing failed.
     */
    public String getText() {
        return text;
    }

    public PrintFailure getFailure() {
        return failure;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String text;
        private PrintFailure failure;
        private String failureMessage;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder failure(PrintFailure failure) {
            this.failure = failure;
            return this;
        }

        public Builder failureMessage(String failureMessage) {
            this.failureMessage = failureMessage;
            return this;
        }

        public PrintResult build() {
            if (failure != null && text != null) {
                throw new IllegalStateException("A failed print result cannot carry text");
            }
            return new PrintResult(this);
        }
    }
}
