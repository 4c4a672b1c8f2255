package com.bel.graph.api;

import com.bel.graph.assembly.BelGraph;
import com.bel.graph.core.model.BelEdge;
import com.bel.graph.core.model.Node;
import com.bel.graph.core.model.Term;
import com.bel.graph.core.model.WarningKind;
import com.bel.graph.namespace.CachingNamespaceResolver;
import com.bel.graph.namespace.NamespaceResolver;
import com.bel.graph.namespace.Resolution;
import com.bel.graph.namespace.ResolverCacheConfig;
import com.bel.graph.parser.ParseResult;
import com.bel.graph.parser.ParserConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BelCompilerTest {

    private static final String CORPUS = """
            SET DOCUMENT Name = "Round trip"
            DEFINE NAMESPACE HGNC AS URL "http://resources.example.org/hgnc.belns"

            SET Citation = {"PubMed", "Signalling review", "10000001"}
            SET Evidence = "Growth factor signalling"
            proteinAbundance(HGNC:EGFR, proteinModification(Ph, Tyr, 1068)) directlyIncreases \\
                kinaseActivity(p(HGNC:EGFR))
            complexAbundance(p(HGNC:GRB2), p(HGNC:EGFR), p(HGNC:SOS1)) -> act(p(HGNC:HRAS), ma(GTPaseActivity))
            rxn(reactants(a(CHEBI:ATP), p(HGNC:HRAS)), products(a(CHEBI:ADP))) -| bp(GOBP:"cell death")
            tloc(p(HGNC:EGFR), fromLoc(GOCC:"plasma membrane"), toLoc(GOCC:cytoplasm)) => deg(p(HGNC:EGFR))
            p(HGNC:BRAF, sub(V, 600, E)) increases p(fus(HGNC:BCR, "r.1_1000", HGNC:ABL1, "r.500_2000"))
            composite(a(CHEBI:lipopolysaccharide), p(HGNC:IL6)) positiveCorrelation path(MESH:Inflammation)
            r(HGNC:MIR21, loc(GOCC:nucleus)) negativeCorrelation m(HGNC:MIR21)
            """;

    @Nested
    @DisplayName("Canonical form")
    class CanonicalTests {

        private final BelCompiler compiler = BelCompiler.defaults();

        @Test
        @DisplayName("Rendering and re-parsing every node should be a fixed point")
        void testNodeRoundTrip() {
            BelGraph graph = compiler.parse(CORPUS);
            assertFalse(graph.hasWarnings(), () -> graph.getWarnings().toString());

            for (Node node : graph.nodes()) {
                ParseResult<Term> reparsed = compiler.parseTerm(node.term().toBel());
                assertTrue(reparsed.isOk(), () -> node.key() + ": " + reparsed.getFailure());
                assertEquals(node.term(), reparsed.getValue());
                assertEquals(node.key(), reparsed.getValue().toBel());
            }
        }

        @Test
        @DisplayName("Rendering and re-parsing every statement should reproduce the graph")
        void testStatementRoundTrip() {
            BelGraph graph = compiler.parse(CORPUS);
            List<String> rendered = new ArrayList<>();
            rendered.add("SET Citation = {\"PubMed\", \"10000001\"}");
            rendered.add("SET Evidence = \"Growth factor signalling\"");
            for (BelEdge edge : graph.edges()) {
                rendered.add(graph.getNode(edge.source()).key() + " " + edge.relation().getKeyword() + " "
                        + graph.getNode(edge.target()).key());
            }

            BelGraph again = compiler.parse(rendered);

            assertEquals(graph.nodes(), again.nodes());
            assertEquals(graph.edgeCount(), again.edgeCount());
            for (int i = 0; i < graph.edgeCount(); i++) {
                assertEquals(graph.edges().get(i).relation(), again.edges().get(i).relation());
            }
        }

        @Test
        @DisplayName("Unordered arguments should be sorted")
        void testListsSorted() {
            assertEquals("complex(p(HGNC:A), p(HGNC:B))",
                    compiler.parseTerm("complexAbundance(p(HGNC:B), proteinAbundance(HGNC:A))").getValue().toBel());
            assertEquals(compiler.parseTerm("p(HGNC:A, pmod(Ph, S, 9), pmod(Ac))").getValue(),
                    compiler.parseTerm("p(HGNC:A, pmod(Ac), pmod(Ph, Ser, 9))").getValue());
        }

        @Test
        @DisplayName("parseTerm should report failures without throwing")
        void testParseTermFailure() {
            ParseResult<Term> result = compiler.parseTerm("p(HGNC:A");

            assertFalse(result.isOk());
            assertTrue(result.getFailure().isPresent());
            assertThrows(IllegalStateException.class, result::getValue);
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Mock
        private NamespaceResolver resolver;

        @Test
        @DisplayName("Should wrap the resolver in a cache when configured")
        void testCache() {
            when(resolver.resolve(anyString(), anyString())).thenReturn(Resolution.KNOWN);
            BelCompiler compiler = BelCompiler.builder()
                    .resolver(resolver)
                    .cache(ResolverCacheConfig.defaults())
                    .build();

            compiler.parse("p(HGNC:AKT1)\np(HGNC:AKT1, pmod(Ph))\nr(HGNC:AKT1)\n");

            assertInstanceOf(CachingNamespaceResolver.class, compiler.getResolver());
            verify(resolver, times(1)).resolve("HGNC", "AKT1");
        }

        @Test
        @DisplayName("Should use the resolver directly without a cache")
        void testNoCache() {
            BelCompiler compiler = BelCompiler.builder()
                    .resolver(resolver)
                    .cache(ResolverCacheConfig.disabled())
                    .build();

            assertSame(resolver, compiler.getResolver());
        }

        @Test
        @DisplayName("Should apply the configured parser policy")
        void testConfig() {
            BelCompiler compiler = BelCompiler.builder().config(ParserConfig.lenient()).build();

            assertTrue(compiler.getConfig().allowNakedNames());
            assertEquals(1, compiler.parse("p(EGFR)").nodeCount());
        }

        @Test
        @DisplayName("Should require a parser config")
        void testConfigRequired() {
            assertThrows(IllegalStateException.class, () -> BelCompiler.builder().config(null).build());
        }
    }

    @Test
    @DisplayName("parseAll should merge documents")
    void testParseAll(@TempDir Path dir) throws IOException {
        Path first = Files.writeString(dir.resolve("first.bel"), "SET DOCUMENT Name = \"first\"\np(HGNC:A)\np(HGNC:B)\n");
        Path second = Files.writeString(dir.resolve("second.bel"), "p(HGNC:B)\np(HGNC:C)\np(X)\n");

        BelGraph merged = BelCompiler.defaults().parseAll(List.of(first, second));

        assertEquals(3, merged.nodeCount());
        assertEquals("first", merged.getName().orElseThrow());
        assertEquals(1, merged.warningsOf(WarningKind.NAKED_NAME).size());
    }

    @Test
    @DisplayName("Reader input should be parsed like a file")
    void testReader() {
        BelGraph graph = BelCompiler.defaults().parse(new StringReader(CORPUS), "corpus.bel");

        assertEquals("Round trip", graph.getName().orElseThrow());
        assertEquals(8, graph.edgeCount());
    }
}
