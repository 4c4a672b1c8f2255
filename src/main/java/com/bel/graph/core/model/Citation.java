package com.bel.graph.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A literature or web reference backing a statement.
 *
 * @param type      citation type, e.g. {@code PubMed}
 * @param reference identifier of the work within the type, e.g. a PubMed id
 * @param name      optional title
 * @param date      optional publication date
 * @param authors   optional author list, as written in the document
 * @param comment   optional free-text comment
 */
public record Citation(String type, String reference, String name, String date, String authors, String comment) {

    public static final Set<String> TYPES = Set.of(
            "Book", "PubMed", "Journal", "Online Resource", "Other", "URL", "DOI", "PubMed Central");

    public Citation {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(reference, "reference is required");
    }

    public static Citation of(String type, String reference) {
        return new Citation(type, reference, null, null, null, null);
    }

    public static Citation of(String type, String reference, String name) {
        return new Citation(type, reference, name, null, null, null);
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public boolean isEmpty() {
        return type.isBlank() || reference.isBlank();
    }

    @Override
    public String toString() {
        return name != null ? type + ":" + reference + " (" + name + ")" : type + ":" + reference;
    }
}
