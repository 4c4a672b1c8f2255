package com.bel.graph.assembly;

import com.bel.graph.core.model.BelEdge;
import com.bel.graph.core.model.BelFunction;
import com.bel.graph.core.model.Citation;
import com.bel.graph.core.model.Context;
import com.bel.graph.core.model.EntityTerm;
import com.bel.graph.core.model.Identifier;
import com.bel.graph.core.model.ListTerm;
import com.bel.graph.core.model.ParseWarning;
import com.bel.graph.core.model.ReactionTerm;
import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.Term;
import com.bel.graph.core.model.Variant;
import com.bel.graph.core.model.VariantTerm;
import com.bel.graph.core.model.WarningKind;
import com.bel.graph.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class GraphAssemblerTest {

    private static EntityTerm protein(String name) {
        return new EntityTerm(BelFunction.PROTEIN, Identifier.of("HGNC", name));
    }

    private static Context context(String evidence) {
        return new Context(Citation.of("PubMed", "1"), evidence, Map.of());
    }

    @Nested
    @DisplayName("Nodes")
    class NodeTests {

        @Test
        @DisplayName("Registering an equal term should reuse its node")
        void testRegisterIdempotent() {
            GraphAssembler assembler = new GraphAssembler(new BelGraph());

            int first = assembler.registerNode(protein("AKT1"));
            int second = assembler.registerNode(protein("AKT1"));
            int other = assembler.registerNode(protein("MAPK1"));

            assertEquals(first, second);
            assertNotEquals(first, other);
            assertEquals(2, assembler.getGraph().nodeCount());
            assertTrue(assembler.getGraph().containsNode(protein("AKT1")));
            assertEquals(first, assembler.getGraph().findNode("p(HGNC:AKT1)").orElseThrow().index());
        }

        @Test
        @DisplayName("Complexes with the same members in any order are one node")
        void testComplexOrderInsensitive() {
            GraphAssembler assembler = new GraphAssembler(new BelGraph());

            int ab = assembler.registerNode(new ListTerm(BelFunction.COMPLEX, List.of(protein("A"), protein("B"))));
            int ba = assembler.registerNode(new ListTerm(BelFunction.COMPLEX, List.of(protein("B"), protein("A"))));

            assertEquals(ab, ba);
            assertEquals(1, assembler.getGraph().nodeCount());
        }
    }

    @Nested
    @DisplayName("Edges")
    class EdgeTests {

        @Test
        @DisplayName("Edges with the same full key should be stored once")
        void testEdgeDedup() {
            GraphAssembler assembler = new GraphAssembler(new BelGraph());
            int a = assembler.registerNode(protein("A"));
            int b = assembler.registerNode(protein("B"));

            assertTrue(assembler.addEdge(a, b, Relation.INCREASES, context("e1"), 1));
            assertFalse(assembler.addEdge(a, b, Relation.INCREASES, context("e1"), 2));
            assertTrue(assembler.addEdge(a, b, Relation.INCREASES, context("e2"), 3));
            assertTrue(assembler.addEdge(a, b, Relation.DECREASES, context("e1"), 4));

            BelGraph graph = assembler.getGraph();
            assertEquals(3, graph.edgeCount());
            assertEquals(3, graph.outEdges(a).size());
            assertEquals(3, graph.inEdges(b).size());
            assertEquals(3, graph.edgesBetween(a, b).size());
            assertTrue(graph.edgesBetween(b, a).isEmpty());
            assertEquals(1, graph.edges().get(0).lineNumber());
            assertTrue(graph.containsEdge(new BelEdge(a, b, Relation.INCREASES, context("e2"), 99).key()));
        }

        @Test
        @DisplayName("Edges to unknown nodes should be rejected")
        void testUnknownNode() {
            GraphAssembler assembler = new GraphAssembler(new BelGraph());
            int a = assembler.registerNode(protein("A"));

            assertThrows(IllegalArgumentException.class,
                    () -> assembler.addEdge(a, 7, Relation.INCREASES, Context.empty(), 1));
        }
    }

    @Nested
    @DisplayName("Implicit edges")
    class ImplicitEdgeTests {

        private final GraphAssembler assembler = new GraphAssembler(new BelGraph(), true, null);

        private Relation relationBetween(Term source, Term target) {
            BelGraph graph = assembler.getGraph();
            int s = graph.findNode(source).orElseThrow().index();
            int t = graph.findNode(target).orElseThrow().index();
            List<BelEdge> edges = graph.edgesBetween(s, t);
            assertEquals(1, edges.size());
            assertEquals(Context.empty(), edges.get(0).context());
            return edges.get(0).relation();
        }

        @Test
        @DisplayName("A variant should link from its base with hasVariant")
        void testVariant() {
            VariantTerm variant = new VariantTerm(protein("AKT1"),
                    List.of(Variant.proteinModification(Identifier.of("bel", "Ph"), "Ser", "473")));

            assertEquals(0, assembler.registerNode(variant));

            assertEquals(2, assembler.getGraph().nodeCount());
            assertEquals(Relation.HAS_VARIANT, relationBetween(protein("AKT1"), variant));
        }

        @Test
        @DisplayName("A complex should link to its components, a composite to its members")
        void testLists() {
            ListTerm complex = new ListTerm(BelFunction.COMPLEX, List.of(protein("A"), protein("B")));
            ListTerm composite = new ListTerm(BelFunction.COMPOSITE, List.of(protein("A"), protein("C")));

            assembler.registerNode(complex);
            assembler.registerNode(composite);

            assertEquals(5, assembler.getGraph().nodeCount());
            assertEquals(Relation.HAS_COMPONENT, relationBetween(complex, protein("B")));
            assertEquals(Relation.HAS_MEMBER, relationBetween(composite, protein("C")));
            assertEquals(4, assembler.getGraph().edgeCount());
        }

        @Test
        @DisplayName("A reaction should link to its reactants and products")
        void testReaction() {
            EntityTerm glucose = new EntityTerm(BelFunction.ABUNDANCE, Identifier.of("CHEBI", "glucose"));
            EntityTerm g6p = new EntityTerm(BelFunction.ABUNDANCE, Identifier.of("CHEBI", "glucose-6-phosphate"));
            ReactionTerm reaction = new ReactionTerm(List.of(glucose), List.of(g6p));

            assembler.registerNode(reaction);

            assertEquals(Relation.HAS_REACTANT, relationBetween(reaction, glucose));
            assertEquals(Relation.HAS_PRODUCT, relationBetween(reaction, g6p));
        }

        @Test
        @DisplayName("Re-registering should not add implicit edges twice")
        void testNoDuplicates() {
            ListTerm complex = new ListTerm(BelFunction.COMPLEX, List.of(protein("A"), protein("B")));
            assembler.registerNode(complex);
            assembler.registerNode(complex);

            assertEquals(2, assembler.getGraph().edgeCount());
        }
    }

    @Nested
    @DisplayName("Freezing")
    class FreezeTests {

        @Test
        @DisplayName("A completed graph should reject every mutation")
        void testFrozen() {
            GraphAssembler assembler = new GraphAssembler(new BelGraph());
            int a = assembler.registerNode(protein("A"));
            BelGraph graph = assembler.complete();

            assertTrue(graph.isFrozen());
            assertThrows(IllegalStateException.class, () -> assembler.registerNode(protein("B")));
            assertThrows(IllegalStateException.class,
                    () -> assembler.addEdge(a, a, Relation.ASSOCIATION, context("e"), 1));
            assertThrows(IllegalStateException.class,
                    () -> assembler.addWarning(new ParseWarning(1, "x", WarningKind.UNPARSABLE_LINE, "x")));
            assertThrows(IllegalStateException.class, () -> assembler.putMetadata("Name", "x"));
            assertThrows(IllegalStateException.class,
                    () -> assembler.declareAnnotationList("Cell", Set.of("a")));
            assertEquals(1, graph.nodeCount());
        }

        @Test
        @DisplayName("Returned views should be unmodifiable")
        void testUnmodifiableViews() {
            GraphAssembler assembler = new GraphAssembler(new BelGraph());
            assembler.registerNode(protein("A"));
            assembler.declareNamespacePattern("dbSNP", Pattern.compile("rs\\d+"));
            BelGraph graph = assembler.getGraph();

            assertThrows(UnsupportedOperationException.class, () -> graph.nodes().clear());
            assertThrows(UnsupportedOperationException.class, () -> graph.getNamespacePatterns().clear());
        }
    }

    @Test
    @DisplayName("Should record metadata, declarations and warnings")
    void testMetadataAndWarnings() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        GraphAssembler assembler = new GraphAssembler(new BelGraph(), false, new MicrometerMetricsService(registry));

        assembler.putMetadata(BelGraph.METADATA_NAME, "Corpus");
        assembler.declareNamespaceUrl("HGNC", "http://example.org/hgnc.belns");
        assembler.declareAnnotationList("Cell", Set.of("HeLa"));
        assembler.addWarning(new ParseWarning(3, "p(X)", WarningKind.NAKED_NAME, "naked"));
        assembler.registerNode(protein("A"));

        BelGraph graph = assembler.getGraph();
        assertEquals("Corpus", graph.getName().orElseThrow());
        assertEquals("http://example.org/hgnc.belns", graph.getNamespaceUrls().get("HGNC"));
        assertEquals(Set.of("HeLa"), graph.getAnnotationLists().get("Cell"));
        assertEquals(1, graph.warningsOf(WarningKind.NAKED_NAME).size());
        assertEquals(1.0, registry.find("bel.warnings").tag("kind", "NAKED_NAME").counter().count());
        assertEquals(1.0, registry.find("bel.nodes.registered").counter().count());
    }
}
