package com.docprinter.api.error;

public enum Severity {
    FATAL,   // The document could not be printed at all
    ERROR,   // Parse errors, the source is left untouched
    WARNING, // Reported by the front-end, formatting still proceeds
    INFO     // Informational, e.g. skipped documents
}
