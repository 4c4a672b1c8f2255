package com.bel.graph.core.model;

/**
 * A graph node: the unique, interned identity of a term.
 *
 * @param index position in the graph's node table
 * @param key   canonical BEL key of the term
 * @param term  the term itself
 */
public record Node(int index, String key, Term term) {

    public BelFunction function() {
        return term.function();
    }

    @Override
    public String toString() {
        return "Node{" + index + ": " + key + '}';
    }
}
