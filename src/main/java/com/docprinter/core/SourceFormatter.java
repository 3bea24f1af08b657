package com.docprinter.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.docprinter.api.DocumentPrinter;
import com.docprinter.api.FormatterPlugin;
import com.docprinter.api.FormatterResult;
import com.docprinter.api.ParsedSource;
import com.docprinter.api.PrintResult;
import com.docprinter.api.error.FormatterError;
import com.docprinter.api.error.Severity;
import com.docprinter.config.FormatterConfig;
import com.docprinter.doc.Doc;
import com.docprinter.doc.DocSerializer;
import com.docprinter.util.ErrorFormatter;
import com.docprinter.util.LoggerUtil;

/**
 * The formatting pipeline for one language: parse with the plugin's front-end,
 * map the tree to a document, print it.
 *
 * <p>Each document is formatted independently, so {@link #formatAll} spreads
 * documents over a thread pool. Cancellation is only observed between documents;
 * a print that has started always runs to completion.
 *
 * @param <T> the syntax tree type of the plugin
 */
public class SourceFormatter<T> {
    private static final Logger logger = LoggerUtil.getLogger(SourceFormatter.class);
    private final FormatterPlugin<T> plugin;
    private final FormatterConfig config;
    private final DocumentPrinter printer;
    private final ErrorFormatter errorFormatter = new ErrorFormatter(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger processedCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public SourceFormatter(FormatterPlugin<T> plugin, FormatterConfig config) {
        this(plugin, config, new LayoutPrinter());
    }

    public SourceFormatter(FormatterPlugin<T> plugin, FormatterConfig config, DocumentPrinter printer) {
        this.plugin = plugin;
        this.config = config;
        this.printer = printer;
        logger.fine("Source formatter created with " + config.getLayout());
    }

    /**
     * Formats one source text. Never throws: problems are reported in the result
     * and the original text is returned unchanged.
     */
    public FormatterResult format(String sourceCode) {
        processedCount.incrementAndGet();
        try {
            ParsedSource<T> parsed = plugin.parse(sourceCode);
            if (parsed.hasErrors()) {
                errorCount.incrementAndGet();
                logger.fine("Not formatting source with parse errors: " +
                        parsed.diagnostics().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
                return FormatterResult.builder()
                        .successful(false)
                        .formattedCode(sourceCode)
                        .errors(parsed.diagnostics())
                        .build();
            }

            Doc document = plugin.toDoc(parsed.tree());
            PrintResult printed = printer.print(document, config.getLayout());

            if (!printed.isSuccessful()) {
                errorCount.incrementAndGet();
                return FormatterResult.builder()
                        .successful(false)
                        .formattedCode(sourceCode)
                        .errors(parsed.diagnostics())
                        .addError(FormatterError.ofDocument(Severity.FATAL, printed.getFailureMessage()))
                        .failureMessage(printed.getFailureMessage())
                        .build();
            }

            successCount.incrementAndGet();
            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(printed.getText())
                    .errors(parsed.diagnostics())
                    .docTree(config.isIncludeDocTree() ? docTree(document) : "")
                    .build();
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error while formatting", e);

            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(FormatterError.ofDocument(Severity.FATAL, "Unexpected error: " + e.getMessage()))
                    .failureMessage("Unexpected error: " + e.getMessage())
                    .build();
        }
    }

    /**
     * Serializes the document for debugging. A failure here leaves the tree empty
     * and does not affect the formatted code.
     */
    private String docTree(Doc document) {
        try {
            return DocSerializer.toJson(document, config.getLayout().getMaxDepth());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Could not serialize document tree", e);
            return "";
        }
    }

    /**
     * Formats every source concurrently, keyed like the input and in input order.
     */
    public Map<String, FormatterResult> formatAll(Map<String, String> sources, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive: " + threadCount);
        }
        Map<String, FormatterResult> results = new ConcurrentHashMap<>();
        if (sources.isEmpty()) {
            return new LinkedHashMap<>();
        }

        logger.info("Formatting " + sources.size() + " documents on " + threadCount + " threads");
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        try {
            for (Map.Entry<String, String> entry : sources.entrySet()) {
                executor.submit(() -> results.put(entry.getKey(), formatUnlessCancelled(entry.getValue())));
            }

            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for documents to be formatted");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Formatting interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }

        Map<String, FormatterResult> ordered = new LinkedHashMap<>();
        for (String name : sources.keySet()) {
            FormatterResult result = results.get(name);
            if (result == null) {
                result = skipped(sources.get(name), "Not formatted before shutdown");
            }
            if (!result.isSuccessful() && logger.isLoggable(Level.FINE)) {
                logger.fine(errorFormatter.formatResult(name, result));
            }
            ordered.put(name, result);
        }

        logger.info("Formatted " + ordered.size() + " documents: processed=" + processedCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());
        return ordered;
    }

    private FormatterResult formatUnlessCancelled(String sourceCode) {
        if (cancelled.get()) {
            return skipped(sourceCode, "Cancelled");
        }
        return format(sourceCode);
    }

    private static FormatterResult skipped(String sourceCode, String reason) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(sourceCode)
                .addError(FormatterError.ofDocument(Severity.INFO, reason))
                .failureMessage(reason)
                .build();
    }

    /**
     * Stops {@link #formatAll} from starting further documents.
     */
    public void cancel() {
        cancelled.set(true);
        logger.info("Formatting cancelled: processed=" + processedCount.get());
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int getProcessedCount() {
        return processedCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }
}
