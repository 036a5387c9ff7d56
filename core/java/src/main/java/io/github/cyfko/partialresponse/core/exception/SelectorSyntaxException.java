package io.github.cyfko.partialresponse.core.exception;

import io.github.cyfko.partialresponse.core.model.ParseResult;

/**
 * Exception signalling a malformed field selector.
 * <p>
 * Parsing itself never lets this exception escape: malformed selectors are ordinary client input and are
 * reported as {@link ParseResult.Error} values. The exception is raised when a caller explicitly asks for a
 * selection out of a failed result through {@link ParseResult#orElseThrow()}.
 * </p>
 *
 * <pre>{@code
 * try {
 *     Selection selection = parser.parse(fields).orElseThrow();
 * } catch (SelectorSyntaxException e) {
 *     return ResponseEntity.badRequest()
 *         .body("Invalid fields parameter at position " + e.getPosition() + ": " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SelectorSyntaxException extends RuntimeException {

    private final int position;

    /**
     * Creates a new exception for the violation found at the given offset.
     *
     * @param message  description of the violation
     * @param position zero-based character offset in the raw selector
     */
    public SelectorSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return zero-based character offset of the violation in the raw selector
     */
    public int getPosition() {
        return position;
    }
}
