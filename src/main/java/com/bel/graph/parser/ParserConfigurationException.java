package com.bel.graph.parser;

/**
 * Thrown when a parser configuration is invalid or contradictory. This is the only
 * error that prevents a parser from being built; it is raised before any input is read.
 */
public class ParserConfigurationException extends IllegalArgumentException {

    public ParserConfigurationException(String message) {
        super(message);
    }
}
