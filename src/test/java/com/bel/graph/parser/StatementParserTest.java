package com.bel.graph.parser;

import com.bel.graph.assembly.BelGraph;
import com.bel.graph.assembly.GraphAssembler;
import com.bel.graph.core.model.BelEdge;
import com.bel.graph.core.model.Citation;
import com.bel.graph.core.model.Context;
import com.bel.graph.core.model.ErrorCategory;
import com.bel.graph.core.model.Relation;
import com.bel.graph.core.model.WarningKind;
import com.bel.graph.namespace.NamespaceResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementParserTest {

    private BelGraph graph;
    private ControlContext context;

    private StatementParser parser(ParserConfig config) {
        graph = new BelGraph();
        GraphAssembler assembler = new GraphAssembler(graph, config.inferImplicitEdges(), null);
        context = ControlContext.of(config);
        return new StatementParser(new TermParser(config, NamespaceResolver.permissive(), assembler), context,
                assembler);
    }

    private void qualify() {
        context.setCitation(Citation.of("PubMed", "12345"));
        context.setEvidence("Evidence text");
    }

    @Nested
    @DisplayName("Simple statements")
    class SimpleTests {

        @Test
        @DisplayName("Should add a qualified edge under citation and evidence")
        void testQualified() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();

            ParseResult<Integer> result = parser.parseStatement("p(HGNC:AKT1) increases p(HGNC:MAPK1)", 5);

            assertEquals(1, result.getValue());
            assertEquals(2, graph.nodeCount());
            BelEdge edge = graph.edges().get(0);
            assertEquals(Relation.INCREASES, edge.relation());
            assertEquals("p(HGNC:AKT1)", graph.getNode(edge.source()).key());
            assertEquals("p(HGNC:MAPK1)", graph.getNode(edge.target()).key());
            assertEquals("Evidence text", edge.context().evidence());
            assertEquals(5, edge.lineNumber());
        }

        @Test
        @DisplayName("Should accept relation symbols")
        void testSymbols() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();

            parser.parseStatement("p(HGNC:A) -| p(HGNC:B)", 1);
            parser.parseStatement("g(HGNC:A) :> r(HGNC:A)", 2);

            assertEquals(Relation.DECREASES, graph.edges().get(0).relation());
            assertEquals(Relation.TRANSCRIBED_TO, graph.edges().get(1).relation());
        }

        @Test
        @DisplayName("Identical statements under identical context add one edge")
        void testIdempotence() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();

            assertEquals(1, parser.parseStatement("p(HGNC:A) increases p(HGNC:B)", 1).getValue());
            assertEquals(0, parser.parseStatement("proteinAbundance(HGNC:A) -> p(HGNC:B)", 2).getValue());

            assertEquals(2, graph.nodeCount());
            assertEquals(1, graph.edgeCount());
        }

        @Test
        @DisplayName("A bare term registers its node only")
        void testBareTerm() {
            StatementParser parser = parser(ParserConfig.defaults());

            assertEquals(0, parser.parseStatement("p(HGNC:A)", 1).getValue());
            assertEquals(1, graph.nodeCount());
            assertEquals(0, graph.edgeCount());
            assertFalse(graph.hasWarnings());
        }

        @Test
        @DisplayName("Unqualified relations need no context and carry none")
        void testUnqualified() {
            StatementParser parser = parser(ParserConfig.defaults());
            context.setAnnotation("Cell", "a");

            parser.parseStatement("complex(p(HGNC:A), p(HGNC:B)) hasComponent p(HGNC:A)", 1);

            assertEquals(1, graph.edgeCount());
            assertEquals(Context.empty(), graph.edges().get(0).context());
            assertFalse(graph.hasWarnings());
        }

        @Test
        @DisplayName("Multi-valued annotations expand into one edge per value")
        void testAnnotationExpansion() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();
            context.setAnnotation("Cell", "a", "b");

            assertEquals(2, parser.parseStatement("p(HGNC:A) increases p(HGNC:B)", 1).getValue());
            assertEquals(List.of("a", "b"),
                    graph.edges().stream().map(e -> e.context().annotations().get("Cell")).toList());
        }
    }

    @Nested
    @DisplayName("Missing context")
    class MissingContextTests {

        @Test
        @DisplayName("Should drop a qualified statement without evidence")
        void testMissingEvidence() {
            StatementParser parser = parser(ParserConfig.defaults());
            context.setCitation(Citation.of("PubMed", "1"));

            ParseResult<Integer> result = parser.parseStatement("p(HGNC:A) increases p(HGNC:B)", 9);

            assertFalse(result.isOk());
            assertEquals(WarningKind.MISSING_CONTEXT, result.failure().kind());
            assertEquals(ErrorCategory.SEMANTIC, result.failure().category());
            assertEquals(0, graph.nodeCount());
            assertEquals(1, graph.getWarnings().size());
            assertEquals(9, graph.getWarnings().get(0).lineNumber());
        }
    }

    @Nested
    @DisplayName("Nested statements")
    class NestedTests {

        @Test
        @DisplayName("Should yield two edges with identical context")
        void testNested() {
            StatementParser parser = parser(ParserConfig.builder().allowNested(true).build());
            qualify();

            ParseResult<Integer> result = parser.parseStatement(
                    "p(HGNC:A) increases (p(HGNC:B) decreases p(HGNC:C))", 1);

            assertEquals(2, result.getValue());
            BelEdge outer = graph.edges().get(0);
            BelEdge inner = graph.edges().get(1);
            assertEquals("p(HGNC:A)", graph.getNode(outer.source()).key());
            assertEquals("p(HGNC:B)", graph.getNode(outer.target()).key());
            assertEquals(Relation.INCREASES, outer.relation());
            assertEquals("p(HGNC:B)", graph.getNode(inner.source()).key());
            assertEquals("p(HGNC:C)", graph.getNode(inner.target()).key());
            assertEquals(Relation.DECREASES, inner.relation());
            assertEquals(outer.context(), inner.context());
        }

        @Test
        @DisplayName("An unqualified inner relation should share the outer edge's context")
        void testNestedMixedQualification() {
            StatementParser parser = parser(ParserConfig.builder().allowNested(true).build());
            qualify();

            ParseResult<Integer> result = parser.parseStatement(
                    "p(HGNC:A) increases (g(HGNC:B) transcribedTo r(HGNC:B))", 1);

            assertEquals(2, result.getValue());
            BelEdge outer = edgeWith(Relation.INCREASES);
            BelEdge inner = edgeWith(Relation.TRANSCRIBED_TO);
            assertEquals(outer.context(), inner.context());
            assertEquals("Evidence text", inner.context().evidence());
        }

        @Test
        @DisplayName("A qualified inner relation should share the unqualified outer edge's context")
        void testNestedQualifiedInner() {
            StatementParser parser = parser(ParserConfig.builder().allowNested(true).build());
            qualify();

            parser.parseStatement("p(HGNC:A) orthologous (p(HGNC:B) decreases p(HGNC:C))", 1);

            BelEdge outer = edgeWith(Relation.ORTHOLOGOUS);
            BelEdge inner = edgeWith(Relation.DECREASES);
            assertEquals(outer.context(), inner.context());
            assertEquals(Citation.of("PubMed", "12345"), outer.context().citation());
        }

        private BelEdge edgeWith(Relation relation) {
            return graph.edges().stream().filter(e -> e.relation() == relation).findFirst().orElseThrow();
        }

        @Test
        @DisplayName("Should reject nesting when not allowed")
        void testNestedNotAllowed() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();

            ParseResult<Integer> result = parser.parseStatement(
                    "p(HGNC:A) increases (p(HGNC:B) decreases p(HGNC:C))", 1);

            assertEquals(WarningKind.NESTED_NOT_ALLOWED, result.failure().kind());
            assertEquals(0, graph.nodeCount());
        }
    }

    @Nested
    @DisplayName("List expansion")
    class ListTests {

        @Test
        @DisplayName("hasComponents should expand to one edge per member")
        void testHasComponents() {
            StatementParser parser = parser(ParserConfig.defaults());

            parser.parseStatement("complex(SCOMP:\"AP-1\") hasComponents list(p(HGNC:FOS), p(HGNC:JUN))", 1);

            assertEquals(2, graph.edgeCount());
            assertTrue(graph.edges().stream().allMatch(e -> e.relation() == Relation.HAS_COMPONENT));
        }

        @Test
        @DisplayName("hasMembers should expand to one edge per member")
        void testHasMembers() {
            StatementParser parser = parser(ParserConfig.defaults());

            parser.parseStatement("p(SFAM:\"AKT Family\") hasMembers list(p(HGNC:AKT1), p(HGNC:AKT2), p(HGNC:AKT3))", 1);

            assertEquals(3, graph.edgeCount());
            assertEquals(4, graph.nodeCount());
            assertTrue(graph.edges().stream().allMatch(e -> e.relation() == Relation.HAS_MEMBER));
        }

        @Test
        @DisplayName("List relations require a list object")
        void testListObjectRequired() {
            StatementParser parser = parser(ParserConfig.defaults());

            ParseResult<Integer> result = parser.parseStatement("p(SFAM:x) hasMembers p(HGNC:AKT1)", 1);

            assertEquals(WarningKind.MALFORMED_TERM, result.failure().kind());
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Unknown relation keywords are structural errors")
        void testUnknownRelation() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();

            ParseResult<Integer> result = parser.parseStatement("p(HGNC:A) frobnicates p(HGNC:B)", 1);

            assertEquals(WarningKind.UNKNOWN_RELATION, result.failure().kind());
            assertEquals(ErrorCategory.STRUCTURAL, result.failure().category());
        }

        @Test
        @DisplayName("Trailing tokens are lexical errors")
        void testTrailingTokens() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();

            ParseResult<Integer> result = parser.parseStatement("p(HGNC:A) -> p(HGNC:B) p(HGNC:C)", 1);

            assertEquals(WarningKind.UNPARSABLE_LINE, result.failure().kind());
            assertEquals(ErrorCategory.LEXICAL, result.failure().category());
            assertEquals(0, graph.nodeCount());
        }

        @Test
        @DisplayName("Naked names abandon the statement")
        void testNakedName() {
            StatementParser parser = parser(ParserConfig.defaults());
            qualify();

            ParseResult<Integer> result = parser.parseStatement("p(EGFR) increases p(HGNC:B)", 1);

            assertEquals(WarningKind.NAKED_NAME, result.failure().kind());
            assertEquals(0, graph.nodeCount());
        }
    }

    @Test
    @DisplayName("Implicit edges should be inferred when enabled")
    void testImplicitEdges() {
        StatementParser parser = parser(ParserConfig.builder().inferImplicitEdges(true).build());

        parser.parseStatement("complex(p(HGNC:A), p(HGNC:B, pmod(Ph)))", 1);

        assertEquals(4, graph.nodeCount());
        assertEquals(2, graph.edgeCount() - graph.edges().stream()
                .filter(e -> e.relation() == Relation.HAS_VARIANT).count());
        assertEquals(1, graph.edges().stream().filter(e -> e.relation() == Relation.HAS_VARIANT).count());
    }
}
