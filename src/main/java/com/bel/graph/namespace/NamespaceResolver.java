package com.bel.graph.namespace;

import java.util.Optional;
import java.util.Set;

/**
 * Controlled-vocabulary lookup consumed by the term parser.
 *
 * <p>Implementations are supplied by the caller (typically backed by a namespace cache)
 * and may be slow; calls are synchronous. Implementations shared between concurrent
 * parses must be thread-safe.</p>
 */
public interface NamespaceResolver {

    /**
     * Checks whether {@code name} belongs to the namespace {@code namespace}.
     *
     * @param namespace the namespace keyword, e.g. {@code HGNC}
     * @param name      the entity name
     * @return the resolution outcome, never {@code null}
     */
    Resolution resolve(String namespace, String name);

    /**
     * Returns all names of a namespace, for bulk checks, when the resolver can enumerate them.
     */
    default Optional<Set<String>> namespaceTerms(String namespace) {
        return Optional.empty();
    }

    /**
     * A resolver that accepts every name.
     */
    static NamespaceResolver permissive() {
        return PermissiveNamespaceResolver.INSTANCE;
    }
}
