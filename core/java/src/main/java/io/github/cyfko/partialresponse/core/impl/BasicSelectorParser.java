package io.github.cyfko.partialresponse.core.impl;

import io.github.cyfko.partialresponse.core.api.SelectorParser;
import io.github.cyfko.partialresponse.core.cache.BoundedLRUCache;
import io.github.cyfko.partialresponse.core.config.CachePolicy;
import io.github.cyfko.partialresponse.core.config.SelectorPolicy;
import io.github.cyfko.partialresponse.core.exception.SelectorSyntaxException;
import io.github.cyfko.partialresponse.core.model.ParseResult;
import io.github.cyfko.partialresponse.core.model.Selection;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Single-pass recursive descent implementation of {@link SelectorParser}.
 *
 * <h2>Characteristics</h2>
 * <ul>
 *   <li><strong>O(n)</strong>: every character is visited once, no backtracking</li>
 *   <li><strong>Merge on the fly</strong>: repeated fields ({@code a(b),a(c)}, {@code a/b,a/c}) accumulate into the
 *       same node of a {@link Selection.Builder}</li>
 *   <li><strong>Fail fast</strong>: parsing stops at the first violation, no partial tree is returned</li>
 *   <li><strong>Bounded</strong>: selector length and nesting depth are limited by the {@link SelectorPolicy}</li>
 *   <li><strong>Cached</strong>: results are memoised per raw selector according to the {@link CachePolicy}</li>
 * </ul>
 *
 * <pre>{@code
 * SelectorParser parser = new BasicSelectorParser();
 * ParseResult result = parser.parse("kind,items(title,id)");
 *
 * SelectorParser publicApiParser = new BasicSelectorParser(SelectorPolicy.strict(), CachePolicy.custom(200));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicSelectorParser implements SelectorParser {

    private static final Logger logger = Logger.getLogger(BasicSelectorParser.class.getName());

    private static final String WILDCARD = "*";

    private final SelectorPolicy selectorPolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, ParseResult> cache;

    public BasicSelectorParser() {
        this(SelectorPolicy.defaults(), CachePolicy.defaults());
    }

    public BasicSelectorParser(SelectorPolicy selectorPolicy) {
        this(selectorPolicy, CachePolicy.defaults());
    }

    /**
     * @param selectorPolicy parser limits
     * @param cachePolicy    parse result caching
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicSelectorParser(SelectorPolicy selectorPolicy, CachePolicy cachePolicy) {
        if (selectorPolicy == null) {
            throw new IllegalArgumentException("Selector policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.selectorPolicy = selectorPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    public SelectorPolicy getSelectorPolicy() {
        return selectorPolicy;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * @return cache statistics, or a map holding only {@code enabled=false} when caching is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize()
        );
    }

    @Override
    public ParseResult parse(String selector) {
        if (selector == null) {
            return ParseResult.absent();
        }

        if (cache != null) {
            return cache.computeIfAbsent(selector, this::parseUncached);
        }
        return parseUncached(selector);
    }

    private ParseResult parseUncached(String selector) {
        if (selector.length() > selectorPolicy.maxSelectorLength()) {
            return ParseResult.error(String.format(
                    "Selector too long (%d characters, max: %d). Policy applied: %s",
                    selector.length(), selectorPolicy.maxSelectorLength(), selectorPolicy.policyName()
            ), selectorPolicy.maxSelectorLength());
        }

        try {
            return ParseResult.present(new SelectorReader(selector, selectorPolicy).readSelection());
        } catch (SelectorSyntaxException e) {
            logger.fine(() -> "Malformed selector '" + selector + "': " + e.getMessage());
            return ParseResult.error(e.getMessage(), e.getPosition());
        }
    }

    /**
     * Parsing state for one selector. Errors are raised as {@link SelectorSyntaxException} to unwind the
     * recursion and converted to {@link ParseResult.Error} by the caller.
     */
    private static final class SelectorReader {
        private final String input;
        private final SelectorPolicy policy;
        private int pos;

        SelectorReader(String input, SelectorPolicy policy) {
            this.input = input;
            this.policy = policy;
        }

        Selection readSelection() {
            skipWhitespace();
            if (atEnd()) {
                return Selection.empty();
            }

            Selection.Builder root = Selection.builder();
            readGroup(root, 0);

            // a top-level group only stops early on ')'
            if (!atEnd()) {
                throw new SelectorSyntaxException("Unbalanced ')' at position " + pos, pos);
            }
            return root.build();
        }

        private void readGroup(Selection.Builder target, int depth) {
            while (true) {
                readItem(target, depth);
                skipWhitespace();
                if (atEnd() || current() == ')') {
                    return;
                }
                if (current() != ',') {
                    throw new SelectorSyntaxException(
                            "Expected ',' or ')' but found '" + current() + "' at position " + pos, pos);
                }
                pos++;
            }
        }

        private void readItem(Selection.Builder target, int depth) {
            skipWhitespace();
            if (atEnd()) {
                throw new SelectorSyntaxException("Empty field name at end of selector", pos);
            }

            switch (current()) {
                case ',':
                    throw new SelectorSyntaxException("Empty field name at position " + pos, pos);
                case ')':
                    throw new SelectorSyntaxException(depth == 0
                            ? "Unbalanced ')' at position " + pos
                            : "Empty field name at position " + pos, pos);
                case '(':
                    throw new SelectorSyntaxException("'(' must be preceded by a field name at position " + pos, pos);
                case '/':
                    throw new SelectorSyntaxException("'/' must be preceded by a field name at position " + pos, pos);
                default:
                    break;
            }

            int start = pos;
            while (!atEnd() && !isDelimiter(current())) {
                pos++;
            }
            String name = input.substring(start, pos).strip();

            if (WILDCARD.equals(name)) {
                if (!atEnd() && (current() == '(' || current() == '/')) {
                    throw new SelectorSyntaxException(
                            "Wildcard '*' cannot have a sub-selection at position " + pos, pos);
                }
                target.wildcard();
                return;
            }

            if (atEnd() || (current() != '(' && current() != '/')) {
                target.leaf(name);
                return;
            }

            Selection.Builder child = target.field(name);
            if (current() == '(') {
                int open = pos;
                checkDepth(depth + 1, open);
                pos++;
                readGroup(child, depth + 1);
                if (atEnd()) {
                    throw new SelectorSyntaxException(
                            "Unbalanced '(' at position " + open + ": missing ')'", pos);
                }
                pos++;
            } else if (current() == '/') {
                int slash = pos;
                checkDepth(depth + 1, slash);
                pos++;
                skipWhitespace();
                if (atEnd() || isDelimiter(current())) {
                    throw new SelectorSyntaxException(
                            "'/' at position " + slash + " must be followed by a field name", pos);
                }
                readItem(child, depth + 1);
            }
        }

        private void checkDepth(int depth, int at) {
            if (depth > policy.maxDepth()) {
                throw new SelectorSyntaxException(String.format(
                        "Selector nested too deeply at position %d (max depth: %d). Policy applied: %s",
                        at, policy.maxDepth(), policy.policyName()), at);
            }
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(current())) {
                pos++;
            }
        }

        private boolean atEnd() {
            return pos >= input.length();
        }

        private char current() {
            return input.charAt(pos);
        }

        private static boolean isDelimiter(char c) {
            return c == ',' || c == '(' || c == ')' || c == '/';
        }
    }
}
