package com.bel.graph.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ParserConfigTest {

    @Test
    @DisplayName("Defaults should be strict")
    void testDefaults() {
        ParserConfig config = ParserConfig.defaults();

        assertFalse(config.allowNakedNames());
        assertFalse(config.allowNested());
        assertTrue(config.citationClearing());
        assertFalse(config.inferImplicitEdges());
        assertEquals("DIRTY", config.nakedNamespace());
        assertEquals(32, config.maxTermDepth());
    }

    @Test
    @DisplayName("Lenient config should allow naked names and nesting")
    void testLenient() {
        ParserConfig config = ParserConfig.lenient();
        assertTrue(config.allowNakedNames());
        assertTrue(config.allowNested());
    }

    @Test
    @DisplayName("Should reject a non-positive term depth")
    void testInvalidDepth() {
        assertThrows(ParserConfigurationException.class, () -> ParserConfig.builder().maxTermDepth(0).build());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "bad ns", "a:b", "bel"})
    @DisplayName("Should reject unusable naked namespaces")
    void testInvalidNakedNamespace(String namespace) {
        assertThrows(ParserConfigurationException.class,
                () -> ParserConfig.builder().nakedNamespace(namespace).build());
    }

    @Test
    @DisplayName("Configuration errors should be IllegalArgumentExceptions")
    void testExceptionType() {
        assertThrows(IllegalArgumentException.class, () -> ParserConfig.builder().nakedNamespace(null).build());
    }
}
