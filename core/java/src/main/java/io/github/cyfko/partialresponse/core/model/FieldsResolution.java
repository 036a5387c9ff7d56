package io.github.cyfko.partialresponse.core.model;

import io.github.cyfko.partialresponse.core.matching.SelectionMatcher;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * What the host should do with the response of one request, given its raw selector.
 *
 * <table border="1">
 *   <caption>Outcomes</caption>
 *   <tr><th>Outcome</th><th>When</th><th>Host action</th></tr>
 *   <tr><td>{@link Outcome#FILTER}</td><td>non-empty selection parsed</td>
 *       <td>serialize through {@link #predicate()} or {@link #selection()}</td></tr>
 *   <tr><td>{@link Outcome#SERIALIZE_ALL}</td><td>no selector, blank selector, or ignored syntax error</td>
 *       <td>serialize the whole response</td></tr>
 *   <tr><td>{@link Outcome#REJECT}</td><td>syntax error while parse errors are not ignored</td>
 *       <td>answer with a client error; do not serialize</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FieldsResolution {

    public enum Outcome {
        FILTER,
        SERIALIZE_ALL,
        REJECT
    }

    private final Outcome outcome;
    private final Selection selection;
    private final ParseResult.Error error;
    private final boolean ignoreCase;

    private FieldsResolution(Outcome outcome, Selection selection, ParseResult.Error error, boolean ignoreCase) {
        this.outcome = outcome;
        this.selection = selection;
        this.error = error;
        this.ignoreCase = ignoreCase;
    }

    public static FieldsResolution filter(Selection selection, boolean ignoreCase) {
        Objects.requireNonNull(selection, "selection");
        return new FieldsResolution(Outcome.FILTER, selection, null, ignoreCase);
    }

    /**
     * @param ignoredError the syntax error that was ignored, or {@code null}
     * @return a resolution serializing everything
     */
    public static FieldsResolution serializeAll(ParseResult.Error ignoredError) {
        return new FieldsResolution(Outcome.SERIALIZE_ALL, null, ignoredError, false);
    }

    public static FieldsResolution reject(ParseResult.Error error) {
        Objects.requireNonNull(error, "error");
        return new FieldsResolution(Outcome.REJECT, null, error, false);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECT;
    }

    public boolean isFiltering() {
        return outcome == Outcome.FILTER;
    }

    public Optional<Selection> selection() {
        return Optional.ofNullable(selection);
    }

    /**
     * @return the syntax error behind a {@link Outcome#REJECT}, or the ignored one behind a
     *         {@link Outcome#SERIALIZE_ALL}
     */
    public Optional<ParseResult.Error> error() {
        return Optional.ofNullable(error);
    }

    public boolean ignoreCase() {
        return ignoreCase;
    }

    /**
     * @return the inclusion predicate to hand to the serializer
     * @throws IllegalStateException for a rejected request, which must not be serialized
     */
    public Predicate<FieldPath> predicate() {
        switch (outcome) {
            case FILTER:
                return SelectionMatcher.predicate(selection, ignoreCase);
            case SERIALIZE_ALL:
                return path -> true;
            default:
                throw new IllegalStateException("Rejected request has no inclusion predicate: " + error.message());
        }
    }

    @Override
    public String toString() {
        switch (outcome) {
            case FILTER:
                return "FieldsResolution[FILTER " + selection + (ignoreCase ? ", ignoreCase" : "") + "]";
            case SERIALIZE_ALL:
                return "FieldsResolution[SERIALIZE_ALL]";
            default:
                return "FieldsResolution[REJECT " + error.message() + "]";
        }
    }
}
