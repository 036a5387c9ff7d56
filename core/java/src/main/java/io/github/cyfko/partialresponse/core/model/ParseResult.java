package io.github.cyfko.partialresponse.core.model;

import io.github.cyfko.partialresponse.core.exception.SelectorSyntaxException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one selector string.
 *
 * <ul>
 *   <li>{@link Present}: the selector parsed into a {@link Selection} (possibly the empty "select everything"
 *       selection for a blank selector).</li>
 *   <li>{@link Absent}: no selector was supplied. Semantically "select everything", kept distinct so hosts can
 *       skip filtering altogether.</li>
 *   <li>{@link Error}: the first syntax violation, with its zero-based offset in the raw selector.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface ParseResult permits ParseResult.Present, ParseResult.Absent, ParseResult.Error {

    static ParseResult present(Selection selection) {
        return new Present(selection);
    }

    static ParseResult absent() {
        return Absent.INSTANCE;
    }

    static ParseResult error(String message, int position) {
        return new Error(message, position);
    }

    default boolean isPresent() {
        return this instanceof Present;
    }

    default boolean isAbsent() {
        return this instanceof Absent;
    }

    default boolean isError() {
        return this instanceof Error;
    }

    default Optional<Selection> selection() {
        return this instanceof Present ? Optional.of(((Present) this).value()) : Optional.empty();
    }

    default Optional<Error> error() {
        return this instanceof Error ? Optional.of((Error) this) : Optional.empty();
    }

    /**
     * Returns the selection to apply, treating an absent selector as "select everything".
     *
     * @return the parsed selection, or {@link Selection#empty()} when no selector was supplied
     * @throws SelectorSyntaxException if this result is an {@link Error}
     */
    default Selection orElseThrow() {
        if (this instanceof Error) {
            Error error = (Error) this;
            throw new SelectorSyntaxException(error.message(), error.position());
        }
        return selection().orElse(Selection.empty());
    }

    record Present(Selection value) implements ParseResult {
        public Present {
            Objects.requireNonNull(value, "value");
        }
    }

    final class Absent implements ParseResult {
        private static final Absent INSTANCE = new Absent();

        private Absent() {}

        @Override
        public String toString() {
            return "Absent";
        }
    }

    record Error(String message, int position) implements ParseResult {
        public Error {
            Objects.requireNonNull(message, "message");
            if (position < 0) {
                throw new IllegalArgumentException("position must not be negative, got: " + position);
            }
        }
    }
}
