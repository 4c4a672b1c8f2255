package com.bel.graph.parser;

import com.bel.graph.core.model.ParseWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one line or term.
 *
 * <p>A successful result carries the parsed value and any non-blocking notes (e.g. names
 * the resolver did not recognize). A failed result carries the warning that abandoned the
 * line; it may also carry notes collected before the failure.</p>
 *
 * @param value   the parsed value, {@code null} when failed
 * @param notes   non-blocking warnings
 * @param failure the blocking warning, {@code null} when successful
 * @param <T>     the value type
 */
public record ParseResult<T>(T value, List<ParseWarning> notes, ParseWarning failure) {

    public ParseResult {
        notes = notes != null ? List.copyOf(notes) : List.of();
        if ((value == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of value and failure must be set");
        }
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value is required"), List.of(), null);
    }

    public static <T> ParseResult<T> ok(T value, List<ParseWarning> notes) {
        return new ParseResult<>(Objects.requireNonNull(value, "value is required"), notes, null);
    }

    public static <T> ParseResult<T> failed(ParseWarning failure) {
        return new ParseResult<>(null, List.of(), Objects.requireNonNull(failure, "failure is required"));
    }

    public static <T> ParseResult<T> failed(ParseWarning failure, List<ParseWarning> notes) {
        return new ParseResult<>(null, notes, Objects.requireNonNull(failure, "failure is required"));
    }

    public boolean isOk() {
        return failure == null;
    }

    /**
     * Returns the value of a successful result.
     *
     * @throws IllegalStateException if the result failed
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("parse failed: " + failure);
        }
        return value;
    }

    public Optional<ParseWarning> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * All warnings of this result: the notes followed by the failure, if any.
     */
    public List<ParseWarning> warnings() {
        if (failure == null) {
            return notes;
        }
        List<ParseWarning> all = new ArrayList<>(notes);
        all.add(failure);
        return all;
    }
}
