package com.bel.graph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable provenance snapshot attached to an edge.
 *
 * @param citation    the citation in effect, or {@code null}
 * @param evidence    the supporting text in effect, or {@code null}
 * @param annotations annotation name to value, in the order they were set
 */
public record Context(Citation citation, String evidence, Map<String, String> annotations) {

    private static final Context EMPTY = new Context(null, null, Map.of());

    public Context {
        annotations = annotations != null && !annotations.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(annotations))
                : Map.of();
    }

    public static Context empty() {
        return EMPTY;
    }

    public Optional<Citation> getCitation() {
        return Optional.ofNullable(citation);
    }

    public Optional<String> getEvidence() {
        return Optional.ofNullable(evidence);
    }

    public boolean hasCitation() {
        return citation != null && !citation.isEmpty();
    }

    public boolean hasEvidence() {
        return evidence != null && !evidence.isBlank();
    }

    /**
     * Whether a qualified relation may be recorded under this context.
     */
    public boolean isQualifying() {
        return hasCitation() && hasEvidence();
    }

    public boolean isEmpty() {
        return citation == null && evidence == null && annotations.isEmpty();
    }
}
