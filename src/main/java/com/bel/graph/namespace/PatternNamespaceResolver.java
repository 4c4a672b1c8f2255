package com.bel.graph.namespace;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validates namespaces declared {@code AS PATTERN} in a document locally against their
 * regular expression, and delegates every other namespace.
 */
public class PatternNamespaceResolver implements NamespaceResolver {

    private final Map<String, Pattern> patterns;
    private final NamespaceResolver delegate;

    /**
     * @param patterns live view of the document's pattern declarations
     * @param delegate resolver for all other namespaces
     */
    public PatternNamespaceResolver(Map<String, Pattern> patterns, NamespaceResolver delegate) {
        this.patterns = Objects.requireNonNull(patterns, "patterns is required");
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
    }

    @Override
    public Resolution resolve(String namespace, String name) {
        Pattern pattern = patterns.get(namespace);
        if (pattern != null) {
            return pattern.matcher(name).matches() ? Resolution.KNOWN : Resolution.UNKNOWN;
        }
        return delegate.resolve(namespace, name);
    }
}
