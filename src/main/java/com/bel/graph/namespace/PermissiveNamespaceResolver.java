package com.bel.graph.namespace;

/**
 * Resolver that treats every name as known. Used when no vocabulary is configured,
 * so that parsing checks syntax and context only.
 */
public final class PermissiveNamespaceResolver implements NamespaceResolver {

    static final PermissiveNamespaceResolver INSTANCE = new PermissiveNamespaceResolver();

    private PermissiveNamespaceResolver() {
    }

    @Override
    public Resolution resolve(String namespace, String name) {
        return Resolution.KNOWN;
    }
}
