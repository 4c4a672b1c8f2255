package com.bel.graph.core.model;

import java.util.List;

/**
 * A parsed BEL term: an immutable, finite tree rooted at a {@link BelFunction}.
 *
 * <p>Implementations normalize their arguments on construction, so two terms that
 * denote the same entity render to the same canonical BEL and compare equal.</p>
 */
public interface Term extends Comparable<Term> {

    /**
     * The function at the root of this term.
     */
    BelFunction function();

    /**
     * Canonical BEL rendering, using short function names.
     */
    String toBel();

    /**
     * The deduplication key of this term.
     */
    default String key() {
        return toBel();
    }

    /**
     * Direct sub-terms of this term, in canonical order.
     */
    default List<Term> children() {
        return List.of();
    }

    @Override
    default int compareTo(Term other) {
        return key().compareTo(other.key());
    }

    /**
     * Sorts and de-duplicates an unordered argument list.
     */
    static <T extends Term> List<T> normalize(List<T> terms) {
        return terms.stream().distinct().sorted().toList();
    }

    static String render(List<? extends Term> terms) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(terms.get(i).toBel());
        }
        return sb.toString();
    }
}
