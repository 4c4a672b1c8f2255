package com.bel.graph.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermTest {

    private static EntityTerm protein(String name) {
        return new EntityTerm(BelFunction.PROTEIN, Identifier.of("HGNC", name));
    }

    @Nested
    @DisplayName("Canonical rendering")
    class RenderingTests {

        @Test
        @DisplayName("Should render entities with short function names")
        void testEntity() {
            assertEquals("p(HGNC:AKT1)", protein("AKT1").toBel());
            assertEquals("bp(GOBP:\"cell death\")",
                    new EntityTerm(BelFunction.BIOLOGICAL_PROCESS, Identifier.of("GOBP", "cell death")).toBel());
        }

        @Test
        @DisplayName("Should sort and de-duplicate list members")
        void testListNormalization() {
            ListTerm forward = new ListTerm(BelFunction.COMPLEX, List.of(protein("A"), protein("B")));
            ListTerm reversed = new ListTerm(BelFunction.COMPLEX, List.of(protein("B"), protein("A"), protein("B")));

            assertEquals("complex(p(HGNC:A), p(HGNC:B))", reversed.toBel());
            assertEquals(forward, reversed);
            assertEquals(forward.key(), reversed.key());
        }

        @Test
        @DisplayName("Should sort variants")
        void testVariantOrder() {
            Variant pmod = Variant.proteinModification(Identifier.of("bel", "Ph"), "Ser", "473");
            Variant hgvs = Variant.hgvs("p.Gly12Val");

            VariantTerm a = new VariantTerm(protein("AKT1"), List.of(hgvs, pmod));
            VariantTerm b = new VariantTerm(protein("AKT1"), List.of(pmod, hgvs));

            assertEquals("p(HGNC:AKT1, pmod(Ph, Ser, 473), var(\"p.Gly12Val\"))", a.toBel());
            assertEquals(a, b);
        }

        @Test
        @DisplayName("Should render activities, reactions and translocations")
        void testComposite() {
            ActivityTerm activity = new ActivityTerm(protein("AKT1"), Identifier.of("bel", "kin"));
            ReactionTerm reaction = new ReactionTerm(
                    List.of(new EntityTerm(BelFunction.ABUNDANCE, Identifier.of("CHEBI", "b")),
                            new EntityTerm(BelFunction.ABUNDANCE, Identifier.of("CHEBI", "a"))),
                    List.of(new EntityTerm(BelFunction.ABUNDANCE, Identifier.of("CHEBI", "c"))));
            TranslocationTerm translocation = new TranslocationTerm(protein("A"),
                    Identifier.of("GOCC", "intracellular"), Identifier.of("GOCC", "cell surface"));

            assertEquals("act(p(HGNC:AKT1), ma(kin))", activity.toBel());
            assertEquals("act(p(HGNC:AKT1))", new ActivityTerm(protein("AKT1"), null).toBel());
            assertEquals("rxn(reactants(a(CHEBI:a), a(CHEBI:b)), products(a(CHEBI:c)))", reaction.toBel());
            assertEquals("tloc(p(HGNC:A), fromLoc(GOCC:intracellular), toLoc(GOCC:\"cell surface\"))",
                    translocation.toBel());
        }

        @Test
        @DisplayName("Should render fusions with unknown ranges")
        void testFusion() {
            FusionTerm fusion = new FusionTerm(BelFunction.PROTEIN,
                    Identifier.of("HGNC", "BCR"), null, Identifier.of("HGNC", "JAK2"), "p.812_1132");

            assertEquals("p(fus(HGNC:BCR, \"?\", HGNC:JAK2, \"p.812_1132\"))", fusion.toBel());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject non-list functions in list terms")
        void testListFunction() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ListTerm(BelFunction.PROTEIN, List.of(protein("A"))));
        }

        @Test
        @DisplayName("Should reject empty variant lists")
        void testEmptyVariants() {
            assertThrows(IllegalArgumentException.class, () -> new VariantTerm(protein("A"), List.of()));
        }

        @Test
        @DisplayName("Should reject non-transformation functions")
        void testTransformationFunction() {
            assertThrows(IllegalArgumentException.class,
                    () -> new TransformationTerm(BelFunction.PROTEIN, protein("A")));
        }
    }

    @Nested
    @DisplayName("Context")
    class ContextTests {

        @Test
        @DisplayName("Qualifying context needs citation and evidence")
        void testQualifying() {
            assertFalse(Context.empty().isQualifying());
            assertTrue(Context.empty().isEmpty());
            assertFalse(new Context(Citation.of("PubMed", "1"), null, null).isQualifying());
            assertFalse(new Context(Citation.of("PubMed", "1"), " ", null).isQualifying());
            assertTrue(new Context(Citation.of("PubMed", "1"), "text", null).isQualifying());
        }

        @Test
        @DisplayName("Contexts with equal content should be equal")
        void testValueEquality() {
            Context a = new Context(Citation.of("PubMed", "1"), "e", java.util.Map.of("Cell", "x"));
            Context b = new Context(Citation.of("PubMed", "1"), "e", java.util.Map.of("Cell", "x"));
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }
    }

    @Test
    @DisplayName("Relations should resolve long names and symbols")
    void testRelationKeywords() {
        assertEquals(Relation.INCREASES, Relation.fromKeyword("->").orElseThrow());
        assertEquals(Relation.DIRECTLY_DECREASES, Relation.fromKeyword("directlyDecreases").orElseThrow());
        assertEquals(Relation.TRANSCRIBED_TO, Relation.fromKeyword(":>").orElseThrow());
        assertTrue(Relation.INCREASES.isQualified());
        assertFalse(Relation.HAS_COMPONENT.isQualified());
        assertTrue(Relation.fromKeyword("frobnicates").isEmpty());
    }
}
