package com.bel.graph.namespace;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe resolver over namespaces held in memory.
 */
public class InMemoryNamespaceResolver implements NamespaceResolver {

    private final Map<String, Set<String>> namespaces = new ConcurrentHashMap<>();

    public InMemoryNamespaceResolver() {
    }

    public InMemoryNamespaceResolver(Map<String, ? extends Collection<String>> namespaces) {
        namespaces.forEach(this::register);
    }

    /**
     * Registers (or replaces) a namespace with its names.
     */
    public InMemoryNamespaceResolver register(String namespace, Collection<String> names) {
        namespaces.put(namespace, Set.copyOf(names));
        return this;
    }

    public InMemoryNamespaceResolver register(String namespace, String... names) {
        return register(namespace, Set.of(names));
    }

    @Override
    public Resolution resolve(String namespace, String name) {
        Set<String> names = namespaces.get(namespace);
        if (names == null) {
            return Resolution.NAMESPACE_UNDECLARED;
        }
        return names.contains(name) ? Resolution.KNOWN : Resolution.UNKNOWN;
    }

    @Override
    public Optional<Set<String>> namespaceTerms(String namespace) {
        return Optional.ofNullable(namespaces.get(namespace));
    }
}
