package com.bel.graph.assembly;

import com.bel.graph.core.model.BelEdge;
import com.bel.graph.core.model.Node;
import com.bel.graph.core.model.ParseWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Combines graphs parsed independently (e.g. in parallel) into one.
 *
 * <p>Nodes are united by key, edges by full edge key with indices remapped, warnings
 * are concatenated in argument order, and for metadata and declarations the first
 * graph that defines a key wins.</p>
 */
public final class GraphMerger {
    private static final Logger log = LoggerFactory.getLogger(GraphMerger.class);

    private GraphMerger() {
        // utility class
    }

    public static BelGraph merge(BelGraph... graphs) {
        return merge(List.of(graphs));
    }

    public static BelGraph merge(List<BelGraph> graphs) {
        BelGraph merged = new BelGraph();
        GraphAssembler assembler = new GraphAssembler(merged);

        for (BelGraph graph : graphs) {
            int[] remap = new int[graph.nodeCount()];
            for (Node node : graph.nodes()) {
                remap[node.index()] = assembler.registerNode(node.term());
            }
            for (BelEdge edge : graph.edges()) {
                assembler.addEdge(remap[edge.source()], remap[edge.target()], edge.relation(), edge.context(),
                        edge.lineNumber());
            }
            for (ParseWarning warning : graph.getWarnings()) {
                merged.appendWarning(warning);
            }
            graph.getDocument().forEach((k, v) -> putIfAbsent(merged.getDocument(), k, () -> merged.putDocument(k, v)));
            graph.getNamespaceUrls().forEach((k, v) ->
                    putIfAbsent(merged.getNamespaceUrls(), k, () -> merged.putNamespaceUrl(k, v)));
            graph.getNamespacePatterns().forEach((k, v) ->
                    putIfAbsent(merged.getNamespacePatterns(), k, () -> merged.putNamespacePattern(k, v)));
            graph.getAnnotationUrls().forEach((k, v) ->
                    putIfAbsent(merged.getAnnotationUrls(), k, () -> merged.putAnnotationUrl(k, v)));
            graph.getAnnotationLists().forEach((k, v) ->
                    putIfAbsent(merged.getAnnotationLists(), k, () -> merged.putAnnotationList(k, v)));
            graph.getAnnotationPatterns().forEach((k, v) ->
                    putIfAbsent(merged.getAnnotationPatterns(), k, () -> merged.putAnnotationPattern(k, v)));
        }

        merged.freeze();
        log.info("graphs.merged count={} nodes={} edges={}", graphs.size(), merged.nodeCount(), merged.edgeCount());
        return merged;
    }

    private static void putIfAbsent(Map<String, ?> existing, String key, Runnable put) {
        if (!existing.containsKey(key)) {
            put.run();
        }
    }
}
