package com.bel.graph.jgif;

import com.bel.graph.assembly.BelGraph;
import com.bel.graph.assembly.GraphAssembler;
import com.bel.graph.core.model.Citation;
import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.WarningKind;
import com.bel.graph.document.DocumentParser;
import com.bel.graph.logging.LogContext;
import com.bel.graph.metrics.MetricsService;
import com.bel.graph.metrics.NoOpMetricsService;
import com.bel.graph.namespace.NamespaceResolver;
import com.bel.graph.namespace.PatternNamespaceResolver;
import com.bel.graph.parser.ControlContext;
import com.bel.graph.parser.ControlParser;
import com.bel.graph.parser.ParserConfig;
import com.bel.graph.parser.SemanticException;
import com.bel.graph.parser.StatementParser;
import com.bel.graph.parser.TermParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link BelGraph} from the JSON Graph Interchange Format (JGIF).
 *
 * <p>Node labels and edge labels are BEL text and go through the same term and statement
 * parsers as a BEL document. Qualified edges are added once per usable evidence entry (a
 * valid citation and real summary text), with the control context loaded from that entry's
 * citation, summary text and experiment context. Unqualified edges are added once,
 * context-free.</p>
 *
 * <pre>
 * {"graph": {
 *   "label": "...", "metadata": {...},
 *   "nodes": [{"label": "p(HGNC:AKT1)"}],
 *   "edges": [{"relation": "increases", "label": "p(HGNC:AKT1) increases ...",
 *              "metadata": {"evidences": [{"citation": {"type": "PubMed", "id": "123"},
 *                                          "summary_text": "...",
 *                                          "experiment_context": {"Species": "9606"}}]}}]}}
 * </pre>
 */
public class JgifImporter {
    private static final Logger log = LoggerFactory.getLogger(JgifImporter.class);

    public static final String EXPERIMENT_CONTEXT = "experiment_context";

    public static final String PLACEHOLDER_EVIDENCE =
            "This Network edge has no supporting evidence.  Please add real evidence to this edge prior to deleting.";

    private static final Set<String> SKIPPED_RELATIONS = Set.of(
            Relation.ACTS_IN.getKeyword(), Relation.TRANSLOCATES.getKeyword());

    private final ParserConfig config;
    private final NamespaceResolver resolver;
    private final MetricsService metrics;
    private final ObjectMapper objectMapper;

    public JgifImporter(ParserConfig config, NamespaceResolver resolver) {
        this(config, resolver, new NoOpMetricsService());
    }

    public JgifImporter(ParserConfig config, NamespaceResolver resolver, MetricsService metrics) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Reads and imports a JGIF document. Unreadable JSON yields an empty graph with an
     * {@link WarningKind#UNREADABLE_INPUT} warning.
     */
    public BelGraph importGraph(Reader reader) {
        return read(reader).map(this::importGraph).orElseGet(() -> unreadable("jgif"));
    }

    public BelGraph importGraph(JsonNode root) {
        return build(root, Map.of(), Map.of(), "jgif");
    }

    /**
     * Reads and imports a CBN export.
     */
    public BelGraph importCbn(Reader reader) {
        return read(reader).map(this::importCbn).orElseGet(() -> unreadable("cbn-jgif"));
    }

    /**
     * Imports a CBN export: maps its annotations with {@link CbnJgifPreprocessor} and adds
     * the CBN metadata and namespace and annotation declarations.
     */
    public BelGraph importCbn(JsonNode root) {
        return build(CbnJgifPreprocessor.preprocess(root),
                CbnJgifPreprocessor.NAMESPACE_URLS, CbnJgifPreprocessor.ANNOTATION_URLS, "cbn-jgif");
    }

    private Optional<JsonNode> read(Reader reader) {
        try {
            return Optional.of(objectMapper.readTree(reader));
        } catch (IOException e) {
            log.error("jgif.unreadable error={}", e.getMessage());
            return Optional.empty();
        }
    }

    private BelGraph unreadable(String format) {
        GraphAssembler assembler = new GraphAssembler(new BelGraph(), false, metrics);
        assembler.addWarning(new ParseWarning(0, "", WarningKind.UNREADABLE_INPUT, "invalid " + format + " input"));
        return assembler.complete();
    }

    private BelGraph build(JsonNode root, Map<String, String> namespaceUrls, Map<String, String> annotationUrls,
                           String format) {
        long start = System.nanoTime();
        BelGraph graph = new BelGraph();
        GraphAssembler assembler = new GraphAssembler(graph, config.inferImplicitEdges(), metrics);
        ControlContext context = ControlContext.of(config);
        TermParser termParser = new TermParser(config,
                new PatternNamespaceResolver(graph.getNamespacePatterns(), resolver), assembler);
        StatementParser statementParser = new StatementParser(termParser, context, assembler);

        try (LogContext ctx = LogContext.forImport(LogContext.generateParseId(), format)) {
            JsonNode document = root.path("graph");
            if (!document.isObject()) {
                assembler.addWarning(new ParseWarning(0, "", WarningKind.UNREADABLE_INPUT,
                        "JGIF document has no 'graph' object"));
                return assembler.complete();
            }

            JsonNode label = document.get("label");
            if (label != null && label.isValueNode()) {
                assembler.putMetadata(BelGraph.METADATA_NAME, label.asText());
            }
            JsonNode metadata = document.path("metadata");
            for (String key : DocumentParser.DOCUMENT_KEYS) {
                JsonNode value = metadata.get(key);
                if (value != null && value.isValueNode()) {
                    assembler.putMetadata(key, value.asText());
                }
            }
            namespaceUrls.forEach(assembler::declareNamespaceUrl);
            annotationUrls.forEach(assembler::declareAnnotationUrl);

            long index = 0;
            for (JsonNode node : document.path("nodes")) {
                index++;
                JsonNode nodeLabel = node.get("label");
                if (nodeLabel == null || !nodeLabel.isTextual()) {
                    assembler.addWarning(new ParseWarning(index, node.toString(), WarningKind.MALFORMED_TERM,
                            "node " + index + " has no label"));
                    continue;
                }
                termParser.registerTerm(nodeLabel.asText(), index);
            }

            index = 0;
            for (JsonNode edge : document.path("edges")) {
                index++;
                try {
                    importEdge(edge, index, context, statementParser, assembler);
                } catch (RuntimeException e) {
                    log.warn("jgif.edge.failed index={} error={}", index, e.toString());
                    assembler.addWarning(new ParseWarning(index, edge.path("label").asText(""),
                            WarningKind.UNPARSABLE_LINE, "unexpected failure: " + e));
                }
            }

            BelGraph result = assembler.complete();
            metrics.recordParseDuration(Duration.ofNanos(System.nanoTime() - start));
            log.info("jgif.imported format={} nodes={} edges={} warnings={}",
                    format, result.nodeCount(), result.edgeCount(), result.getWarnings().size());
            return result;
        }
    }

    private void importEdge(JsonNode edge, long index, ControlContext context,
                            StatementParser statementParser, GraphAssembler assembler) {
        String relation = edge.path("relation").isTextual() ? edge.path("relation").asText() : null;
        String statement = edge.path("label").isTextual() ? edge.path("label").asText() : null;
        String line = statement != null ? statement : edge.toString();

        if (relation == null) {
            assembler.addWarning(new ParseWarning(index, line, WarningKind.UNKNOWN_RELATION,
                    "edge " + index + " has no relation"));
            return;
        }
        if (SKIPPED_RELATIONS.contains(relation)) {
            log.debug("jgif.edge.skipped index={} relation={}", index, relation);
            return;
        }
        JsonNode metadata = edge.get("metadata");
        if (metadata == null || !metadata.isObject()) {
            assembler.addWarning(new ParseWarning(index, line, WarningKind.MISSING_CONTEXT,
                    "edge " + index + " has no metadata"));
            return;
        }
        if (statement == null) {
            assembler.addWarning(new ParseWarning(index, line, WarningKind.UNPARSABLE_LINE,
                    "edge " + index + " has no BEL statement label"));
            return;
        }

        boolean unqualified = Relation.fromKeyword(relation).map(r -> !r.isQualified()).orElse(false);
        if (unqualified) {
            context.clear();
            statementParser.parseStatement(statement, index);
            return;
        }

        JsonNode evidences = metadata.path("evidences");
        if (!evidences.isArray() || evidences.isEmpty()) {
            log.debug("jgif.edge.skipped index={} reason=no_evidence", index);
            return;
        }
        for (JsonNode evidence : evidences) {
            JsonNode citation = evidence.get("citation");
            if (citation == null || !citation.isObject() || (!citation.has("type") && !citation.has("id"))) {
                continue;
            }
            String summary = evidence.path("summary_text").asText("").strip();
            if (summary.isEmpty() || PLACEHOLDER_EVIDENCE.equals(summary)) {
                continue;
            }

            Citation parsed = new Citation(
                    citation.path("type").asText("").strip(),
                    citation.path("id").asText("").strip(),
                    citation.has("name") ? citation.path("name").asText().strip() : null,
                    null, null, null);
            try {
                ControlParser.checkCitation(parsed);
            } catch (SemanticException e) {
                assembler.addWarning(e.toWarning(index, statement));
                continue;
            }

            context.clear();
            context.setCitation(parsed);
            context.setEvidence(summary);
            Iterator<Map.Entry<String, JsonNode>> annotations = evidence.path(EXPERIMENT_CONTEXT).fields();
            while (annotations.hasNext()) {
                Map.Entry<String, JsonNode> annotation = annotations.next();
                if (annotation.getValue().isValueNode() && !annotation.getValue().asText().isBlank()) {
                    context.setAnnotation(annotation.getKey(), annotation.getValue().asText());
                }
            }
            statementParser.parseStatement(statement, index);
        }
    }
}
