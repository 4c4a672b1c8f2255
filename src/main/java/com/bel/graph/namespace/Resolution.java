package com.bel.graph.namespace;

/**
 * Outcome of validating a name against a namespace.
 */
public enum Resolution {
    /** The name belongs to the namespace. */
    KNOWN,
    /** The namespace exists but does not contain the name. */
    UNKNOWN,
    /** The namespace itself is not known to the resolver. */
    NAMESPACE_UNDECLARED
}
