package com.bel.graph.assembly;

import com.bel.graph.core.model.BelEdge;
import com.bel.graph.core.model.BelFunction;
import com.bel.graph.core.model.Context;
import com.bel.graph.core.model.ListTerm;
import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.ReactionTerm;
import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.Term;
import com.bel.graph.core.model.VariantTerm;
import com.bel.graph.metrics.MetricsService;
import com.bel.graph.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Single point of mutation for a {@link BelGraph}.
 *
 * <p>Nodes are inserted or reused by canonical key; edges are de-duplicated on their full
 * key (source, target, relation, context). With implicit-edge inference enabled, registering
 * a structured term also registers its parts and links them with the context-free relation
 * the structure implies.</p>
 *
 * <p>Not thread-safe: one assembler per graph, one writer per assembler.</p>
 */
public class GraphAssembler {
    private static final Logger log = LoggerFactory.getLogger(GraphAssembler.class);

    private final BelGraph graph;
    private final boolean inferImplicitEdges;
    private final MetricsService metrics;

    public GraphAssembler(BelGraph graph) {
        this(graph, false, new NoOpMetricsService());
    }

    public GraphAssembler(BelGraph graph, boolean inferImplicitEdges, MetricsService metrics) {
        this.graph = Objects.requireNonNull(graph, "graph is required");
        this.inferImplicitEdges = inferImplicitEdges;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public BelGraph getGraph() {
        return graph;
    }

    /**
     * Inserts the term as a node, or returns the index of the existing node with the same key.
     */
    public int registerNode(Term term) {
        return registerNode(term, 0);
    }

    /**
     * Inserts or reuses a node; {@code lineNumber} is recorded on any implicit edges.
     */
    public int registerNode(Term term, long lineNumber) {
        Objects.requireNonNull(term, "term is required");
        int before = graph.nodeCount();
        int index = graph.internNode(term);
        if (graph.nodeCount() > before) {
            metrics.incrementNodeRegistered();
            log.trace("node.registered index={} key={}", index, term.key());
            if (inferImplicitEdges) {
                addImplicitEdges(term, index, lineNumber);
            }
        }
        return index;
    }

    /**
     * Adds an edge unless an edge with the same full key exists.
     *
     * @return {@code true} if the edge was new
     */
    public boolean addEdge(int source, int target, Relation relation, Context context, long lineNumber) {
        BelEdge edge = new BelEdge(source, target, relation, context, lineNumber);
        boolean added = graph.insertEdge(edge);
        if (added) {
            metrics.incrementEdgeAdded(relation);
            log.trace("edge.added source={} target={} relation={}", source, target, relation.getKeyword());
        }
        return added;
    }

    public void addWarning(ParseWarning warning) {
        graph.appendWarning(warning);
        metrics.incrementWarning(warning.kind());
        log.debug("warning.recorded line={} kind={} message={}", warning.lineNumber(), warning.kind(),
                warning.message());
    }

    public void putMetadata(String key, String value) {
        graph.putDocument(key, value);
    }

    public void declareNamespaceUrl(String namespace, String url) {
        graph.putNamespaceUrl(namespace, url);
    }

    public void declareNamespacePattern(String namespace, Pattern pattern) {
        graph.putNamespacePattern(namespace, pattern);
    }

    public void declareAnnotationUrl(String annotation, String url) {
        graph.putAnnotationUrl(annotation, url);
    }

    public void declareAnnotationList(String annotation, Set<String> values) {
        graph.putAnnotationList(annotation, values);
    }

    public void declareAnnotationPattern(String annotation, Pattern pattern) {
        graph.putAnnotationPattern(annotation, pattern);
    }

    /**
     * Freezes and returns the graph.
     */
    public BelGraph complete() {
        graph.freeze();
        return graph;
    }

    private void addImplicitEdges(Term term, int index, long lineNumber) {
        if (term instanceof VariantTerm variantTerm) {
            int base = registerNode(variantTerm.base(), lineNumber);
            addEdge(base, index, Relation.HAS_VARIANT, Context.empty(), lineNumber);
        } else if (term instanceof ListTerm listTerm) {
            Relation relation = listTerm.function() == BelFunction.COMPLEX
                    ? Relation.HAS_COMPONENT
                    : Relation.HAS_MEMBER;
            for (Term member : listTerm.members()) {
                int memberIndex = registerNode(member, lineNumber);
                addEdge(index, memberIndex, relation, Context.empty(), lineNumber);
            }
        } else if (term instanceof ReactionTerm reaction) {
            for (Term reactant : reaction.reactants()) {
                addEdge(index, registerNode(reactant, lineNumber), Relation.HAS_REACTANT, Context.empty(), lineNumber);
            }
            for (Term product : reaction.products()) {
                addEdge(index, registerNode(product, lineNumber), Relation.HAS_PRODUCT, Context.empty(), lineNumber);
            }
        }
    }
}
