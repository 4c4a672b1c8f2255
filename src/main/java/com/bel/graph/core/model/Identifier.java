package com.bel.graph.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A namespace-qualified name such as {@code HGNC:AKT1}.
 *
 * <p>Naked identifiers (names written without a namespace prefix) are only created
 * under lenient parsing, in which case the namespace is the configured placeholder
 * and {@link #naked()} is {@code true}.</p>
 *
 * @param namespace the namespace keyword
 * @param name      the name within the namespace
 * @param naked     whether the namespace was supplied implicitly
 */
public record Identifier(String namespace, String name, boolean naked) implements Comparable<Identifier> {

    /**
     * Namespace of the built-in BEL vocabulary (default activities and modifications).
     */
    public static final String DEFAULT_NAMESPACE = "bel";

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_.]+(-[A-Za-z0-9_.]+)*");

    public Identifier {
        Objects.requireNonNull(namespace, "namespace is required");
        Objects.requireNonNull(name, "name is required");
    }

    public static Identifier of(String namespace, String name) {
        return new Identifier(namespace, name, false);
    }

    public static Identifier naked(String placeholderNamespace, String name) {
        return new Identifier(placeholderNamespace, name, true);
    }

    /**
     * Renders the identifier as BEL, quoting the name when needed.
     */
    public String toBel() {
        return namespace + ":" + quoteIfNeeded(name);
    }

    /**
     * Renders the identifier, omitting the namespace when it is the built-in BEL vocabulary.
     */
    public String toBelOmittingDefault() {
        return DEFAULT_NAMESPACE.equals(namespace) ? quoteIfNeeded(name) : toBel();
    }

    public boolean isDefaultNamespace() {
        return DEFAULT_NAMESPACE.equals(namespace);
    }

    /**
     * Quotes a value unless it consists only of characters allowed in a bare BEL word.
     */
    public static String quoteIfNeeded(String value) {
        if (SAFE_NAME.matcher(value).matches()) {
            return value;
        }
        return quote(value);
    }

    public static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public int compareTo(Identifier other) {
        return toBel().compareTo(other.toBel());
    }

    @Override
    public String toString() {
        return toBel();
    }
}
