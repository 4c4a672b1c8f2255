package com.bel.graph.assembly;

import com.bel.graph.core.model.BelEdge;
import com.bel.graph.core.model.Node;
import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.Term;
import com.bel.graph.core.model.WarningKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * An annotated BEL multigraph.
 *
 * <p>Nodes are interned by canonical term key and referenced by index. Edges are kept in
 * insertion order; two edges with the same {@link BelEdge.Key} are never both stored.
 * The graph also carries the document metadata, the namespace and annotation
 * declarations, and every warning recorded while it was built.</p>
 *
 * <p>All mutation goes through {@link GraphAssembler}. A graph is append-only while it is
 * being built and read-only once {@link #freeze() frozen}. Instances are not thread-safe
 * while mutable.</p>
 */
public class BelGraph {

    public static final String METADATA_NAME = "Name";

    private final Map<String, Integer> nodeIndex = new HashMap<>();
    private final List<Node> nodes = new ArrayList<>();
    private final List<BelEdge> edges = new ArrayList<>();
    private final Set<BelEdge.Key> edgeKeys = new HashSet<>();
    private final Map<Integer, List<BelEdge>> outgoing = new HashMap<>();
    private final Map<Integer, List<BelEdge>> incoming = new HashMap<>();

    private final Map<String, String> document = new LinkedHashMap<>();
    private final Map<String, String> namespaceUrls = new LinkedHashMap<>();
    private final Map<String, Pattern> namespacePatterns = new LinkedHashMap<>();
    private final Map<String, String> annotationUrls = new LinkedHashMap<>();
    private final Map<String, Set<String>> annotationLists = new LinkedHashMap<>();
    private final Map<String, Pattern> annotationPatterns = new LinkedHashMap<>();
    private final List<ParseWarning> warnings = new ArrayList<>();

    private boolean frozen;

    // --- queries ---

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<BelEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public Node getNode(int index) {
        return nodes.get(index);
    }

    public Optional<Node> findNode(String key) {
        Integer index = nodeIndex.get(key);
        return index != null ? Optional.of(nodes.get(index)) : Optional.empty();
    }

    public Optional<Node> findNode(Term term) {
        return findNode(term.key());
    }

    public boolean containsNode(Term term) {
        return nodeIndex.containsKey(term.key());
    }

    public List<BelEdge> outEdges(int index) {
        return Collections.unmodifiableList(outgoing.getOrDefault(index, List.of()));
    }

    public List<BelEdge> inEdges(int index) {
        return Collections.unmodifiableList(incoming.getOrDefault(index, List.of()));
    }

    public List<BelEdge> edgesBetween(int source, int target) {
        return outgoing.getOrDefault(source, List.of()).stream()
                .filter(edge -> edge.target() == target)
                .toList();
    }

    public boolean containsEdge(BelEdge.Key key) {
        return edgeKeys.contains(key);
    }

    public Map<String, String> getDocument() {
        return Collections.unmodifiableMap(document);
    }

    public Optional<String> getName() {
        return Optional.ofNullable(document.get(METADATA_NAME));
    }

    public Map<String, String> getNamespaceUrls() {
        return Collections.unmodifiableMap(namespaceUrls);
    }

    /**
     * Live read-only view of namespaces declared {@code AS PATTERN}.
     */
    public Map<String, Pattern> getNamespacePatterns() {
        return Collections.unmodifiableMap(namespacePatterns);
    }

    public Map<String, String> getAnnotationUrls() {
        return Collections.unmodifiableMap(annotationUrls);
    }

    public Map<String, Set<String>> getAnnotationLists() {
        return Collections.unmodifiableMap(annotationLists);
    }

    public Map<String, Pattern> getAnnotationPatterns() {
        return Collections.unmodifiableMap(annotationPatterns);
    }

    public List<ParseWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<ParseWarning> warningsOf(WarningKind kind) {
        return warnings.stream().filter(w -> w.kind() == kind).toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Makes the graph read-only. Idempotent.
     */
    public void freeze() {
        frozen = true;
    }

    // --- mutation, reserved for GraphAssembler ---

    int internNode(Term term) {
        checkMutable();
        String key = term.key();
        Integer existing = nodeIndex.get(key);
        if (existing != null) {
            return existing;
        }
        int index = nodes.size();
        nodes.add(new Node(index, key, term));
        nodeIndex.put(key, index);
        return index;
    }

    boolean insertEdge(BelEdge edge) {
        checkMutable();
        if (edge.source() < 0 || edge.source() >= nodes.size()
                || edge.target() < 0 || edge.target() >= nodes.size()) {
            throw new IllegalArgumentException("edge references unknown node: " + edge);
        }
        if (!edgeKeys.add(edge.key())) {
            return false;
        }
        edges.add(edge);
        outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        return true;
    }

    void appendWarning(ParseWarning warning) {
        checkMutable();
        warnings.add(warning);
    }

    void putDocument(String key, String value) {
        checkMutable();
        document.put(key, value);
    }

    void putNamespaceUrl(String namespace, String url) {
        checkMutable();
        namespaceUrls.put(namespace, url);
    }

    void putNamespacePattern(String namespace, Pattern pattern) {
        checkMutable();
        namespacePatterns.put(namespace, pattern);
    }

    void putAnnotationUrl(String annotation, String url) {
        checkMutable();
        annotationUrls.put(annotation, url);
    }

    void putAnnotationList(String annotation, Set<String> values) {
        checkMutable();
        annotationLists.put(annotation, Set.copyOf(values));
    }

    void putAnnotationPattern(String annotation, Pattern pattern) {
        checkMutable();
        annotationPatterns.put(annotation, pattern);
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("graph is read-only");
        }
    }

    @Override
    public String toString() {
        return "BelGraph{name=" + document.get(METADATA_NAME) +
                ", nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                ", warnings=" + warnings.size() + '}';
    }
}
