package com.bel.graph.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Puts the identity of one parse or import into the SLF4J MDC for the duration of a
 * try-with-resources block. Closing restores whatever the keys held before, so an import
 * started inside a document parse hands the outer values back.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDocument(LogContext.generateParseId(), "small_corpus.bel")) {
 *     log.info("document.parsed nodes={} edges={}", nodes, edges);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext(String parseId, String operation, String sourceKey, String source) {
        put("parseId", parseId);
        put("operation", operation);
        put(sourceKey, source);
    }

    public static LogContext forDocument(String parseId, String documentName) {
        return new LogContext(parseId, "parse", "document", documentName);
    }

    public static LogContext forImport(String parseId, String format) {
        return new LogContext(parseId, "import", "format", format);
    }

    public static String generateParseId() {
        return UUID.randomUUID().toString();
    }

    private void put(String key, String value) {
        previous.put(key, MDC.get(key));
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
