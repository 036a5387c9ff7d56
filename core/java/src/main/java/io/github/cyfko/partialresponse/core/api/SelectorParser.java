package io.github.cyfko.partialresponse.core.api;

import io.github.cyfko.partialresponse.core.model.ParseResult;
import io.github.cyfko.partialresponse.core.model.Selection;

/**
 * Parser turning a field selector into a {@link Selection} tree.
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * selection := group | ""
 * group     := item ("," item)*
 * item      := fieldname subgroup? | fieldname "/" item | "*"
 * subgroup  := "(" group ")"
 * fieldname := one or more characters other than "," "(" ")" "/"
 * </pre>
 *
 * <h2>Examples</h2>
 * <pre>{@code
 * parser.parse("kind,items(title,id)");  // two fields, items restricted to title and id
 * parser.parse("meta/etag");             // shorthand for meta(etag)
 * parser.parse("a(b),a(c)");             // same as a(b,c)
 * parser.parse("items(*)");              // every field of items
 * parser.parse("");                      // empty selection: no filtering
 * parser.parse(null);                    // ParseResult.absent()
 * }</pre>
 *
 * <p>
 * Whitespace around names and punctuation is ignored. Empty names ({@code a,,b}, {@code a()}), unbalanced
 * parentheses, a {@code /} without a following name and a {@code (} without a preceding name are syntax errors.
 * </p>
 *
 * <p>
 * Implementations must be deterministic and must not throw for malformed input: the first violation is
 * returned as {@link ParseResult.Error} with its character offset.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface SelectorParser {

    /**
     * Parses a raw selector.
     *
     * @param selector the selector as supplied by the client, or {@code null} if none was supplied
     * @return {@link ParseResult.Absent} for {@code null}, {@link ParseResult.Present} for a well-formed
     *         selector, {@link ParseResult.Error} otherwise
     */
    ParseResult parse(String selector);
}
