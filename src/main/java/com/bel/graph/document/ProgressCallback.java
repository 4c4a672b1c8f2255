package com.bel.graph.document;

/**
 * Receives progress updates while a document is parsed.
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NONE = (lines, edges, done) -> { };

    /**
     * @param lines logical lines handled so far
     * @param edges edges in the graph so far
     * @param done  {@code true} only for the last call, made once the document is complete
     */
    void onProgress(long lines, int edges, boolean done);
}
