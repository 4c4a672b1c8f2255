package com.bel.graph.parser;

import com.bel.graph.core.model.Citation;
import com.bel.graph.core.model.Context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The citation, evidence and annotations in effect at the current line of a document.
 *
 * <p>One instance is owned by one parse run. Edges never reference this object: they
 * receive immutable {@link Context} snapshots, so later changes leave existing edges
 * untouched. Not thread-safe.</p>
 */
public class ControlContext {

    private final boolean citationClearing;

    private Citation citation;
    private String evidence;
    private final Map<String, List<String>> annotations = new LinkedHashMap<>();
    private String statementGroup;

    public ControlContext(boolean citationClearing) {
        this.citationClearing = citationClearing;
    }

    public static ControlContext of(ParserConfig config) {
        return new ControlContext(config.citationClearing());
    }

    public boolean isCitationClearing() {
        return citationClearing;
    }

    /**
     * Resets citation, evidence, annotations and statement group.
     */
    public void clear() {
        citation = null;
        evidence = null;
        annotations.clear();
        statementGroup = null;
    }

    /**
     * Sets the citation. With citation clearing on, evidence and annotations are reset first.
     */
    public void setCitation(Citation citation) {
        Objects.requireNonNull(citation, "citation is required");
        if (citationClearing) {
            evidence = null;
            annotations.clear();
        }
        this.citation = citation;
    }

    /**
     * Drops the current citation after a rejected {@code SET Citation}, applying the same
     * clearing rule as {@link #setCitation}.
     */
    public void discardCitation() {
        if (citationClearing) {
            evidence = null;
            annotations.clear();
        }
        citation = null;
    }

    public void setEvidence(String evidence) {
        this.evidence = Objects.requireNonNull(evidence, "evidence is required");
    }

    public void setAnnotation(String name, String... values) {
        setAnnotation(name, List.of(values));
    }

    /**
     * Sets an annotation to one or more values. Several values make every edge created
     * under this context expand into one edge per value.
     */
    public void setAnnotation(String name, List<String> values) {
        Objects.requireNonNull(name, "name is required");
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("at least one value is required for annotation " + name);
        }
        annotations.put(name, values.stream().distinct().toList());
    }

    /**
     * @return {@code true} if the annotation was set
     */
    public boolean unsetAnnotation(String name) {
        return annotations.remove(name) != null;
    }

    public void unsetCitation() {
        citation = null;
    }

    public void unsetEvidence() {
        evidence = null;
    }

    public void unsetAll() {
        clear();
    }

    public void setStatementGroup(String statementGroup) {
        this.statementGroup = Objects.requireNonNull(statementGroup, "statementGroup is required");
    }

    public void unsetStatementGroup() {
        statementGroup = null;
    }

    public Optional<Citation> getCitation() {
        return Optional.ofNullable(citation);
    }

    public Optional<String> getEvidence() {
        return Optional.ofNullable(evidence);
    }

    public Optional<String> getStatementGroup() {
        return Optional.ofNullable(statementGroup);
    }

    public Map<String, List<String>> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    /**
     * Whether a qualified relation may be recorded now.
     */
    public boolean isQualifying() {
        return citation != null && !citation.isEmpty() && evidence != null && !evidence.isBlank();
    }

    /**
     * Immutable snapshots of the current state: one per combination of annotation values,
     * in declaration order. Always at least one.
     */
    public List<Context> snapshots() {
        List<Map<String, String>> combinations = new ArrayList<>();
        combinations.add(new LinkedHashMap<>());
        for (Map.Entry<String, List<String>> entry : annotations.entrySet()) {
            List<Map<String, String>> expanded = new ArrayList<>();
            for (Map<String, String> partial : combinations) {
                for (String value : entry.getValue()) {
                    Map<String, String> next = new LinkedHashMap<>(partial);
                    next.put(entry.getKey(), value);
                    expanded.add(next);
                }
            }
            combinations = expanded;
        }
        return combinations.stream()
                .map(values -> new Context(citation, evidence, values))
                .toList();
    }
}
