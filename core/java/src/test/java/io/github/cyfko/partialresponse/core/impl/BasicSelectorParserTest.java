package io.github.cyfko.partialresponse.core.impl;

import io.github.cyfko.partialresponse.core.config.CachePolicy;
import io.github.cyfko.partialresponse.core.config.SelectorPolicy;
import io.github.cyfko.partialresponse.core.model.ParseResult;
import io.github.cyfko.partialresponse.core.model.Selection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link BasicSelectorParser}: grammar, merge semantics and error reporting.
 */
@DisplayName("BasicSelectorParser Tests")
class BasicSelectorParserTest {

    private final BasicSelectorParser parser = new BasicSelectorParser();

    private Selection parseValid(String selector) {
        ParseResult result = parser.parse(selector);
        assertTrue(result.isPresent(), () -> "Expected a selection for '" + selector + "' but got " + result);
        return result.selection().orElseThrow();
    }

    @Nested
    @DisplayName("Empty and absent selectors")
    class EmptySelectorTests {

        @Test
        @DisplayName("Should report null selector as absent")
        void shouldReportNullAsAbsent() {
            ParseResult result = parser.parse(null);

            assertTrue(result.isAbsent());
            assertFalse(result.isPresent());
            assertFalse(result.isError());
            assertTrue(result.selection().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "   ", "\t\n"})
        @DisplayName("Should parse blank selector into the empty selection")
        void shouldParseBlankIntoEmptySelection(String selector) {
            Selection selection = parseValid(selector);

            assertTrue(selection.isEmpty());
            assertSame(Selection.empty(), selection);
        }
    }

    @Nested
    @DisplayName("Field lists and groups")
    class GroupTests {

        @Test
        @DisplayName("Should parse a single field as a leaf")
        void shouldParseSingleField() {
            Selection selection = parseValid("name");

            assertEquals(List.of("name"), List.copyOf(selection.entries().keySet()));
            assertTrue(selection.entries().get("name").isEmpty());
            assertFalse(selection.hasWildcard());
        }

        @Test
        @DisplayName("Should parse sibling fields in order")
        void shouldParseSiblings() {
            Selection selection = parseValid("a,b,c");

            assertEquals(List.of("a", "b", "c"), List.copyOf(selection.entries().keySet()));
        }

        @Test
        @DisplayName("Should parse nested groups")
        void shouldParseNestedGroups() {
            Selection selection = parseValid("a,b(c,d(e)),f");

            Selection b = selection.entries().get("b");
            assertEquals(List.of("c", "d"), List.copyOf(b.entries().keySet()));
            assertEquals(List.of("e"), List.copyOf(b.entries().get("d").entries().keySet()));
            assertTrue(selection.entries().get("f").isEmpty());
            assertEquals(2, selection.depth());
        }

        @Test
        @DisplayName("Should ignore whitespace around names and punctuation")
        void shouldIgnoreWhitespace() {
            assertEquals(parseValid("a,b(c,d)"), parseValid("  a ,  b ( c , d )  "));
            assertEquals(parseValid("a/b"), parseValid("a / b"));
        }

        @Test
        @DisplayName("Should keep whitespace inside a field name")
        void shouldKeepInnerWhitespace() {
            Selection selection = parseValid(" first name , age");

            assertTrue(selection.entries().containsKey("first name"));
            assertTrue(selection.entries().containsKey("age"));
        }

        @Test
        @DisplayName("Should preserve the case of field names")
        void shouldPreserveCase() {
            Selection selection = parseValid("DisplayName,id");

            assertTrue(selection.entries().containsKey("DisplayName"));
            assertFalse(selection.entries().containsKey("displayname"));
        }
    }

    @Nested
    @DisplayName("Slash shorthand")
    class SlashTests {

        @Test
        @DisplayName("Should desugar a slash chain into nested single-field groups")
        void shouldDesugarSlashChain() {
            assertEquals(parseValid("a(b(c))"), parseValid("a/b/c"));
        }

        @Test
        @DisplayName("Should only nest the item right after the slash")
        void shouldNestOnlyNextItem() {
            Selection selection = parseValid("a/b,c");

            assertEquals(List.of("a", "c"), List.copyOf(selection.entries().keySet()));
            assertEquals(List.of("b"), List.copyOf(selection.entries().get("a").entries().keySet()));
        }

        @Test
        @DisplayName("Should accept a group after a slash chain")
        void shouldAcceptGroupAfterSlash() {
            assertEquals(parseValid("a(b(c,d))"), parseValid("a/b(c,d)"));
        }

        @Test
        @DisplayName("Should accept a wildcard after a slash")
        void shouldAcceptWildcardAfterSlash() {
            Selection selection = parseValid("a/*");

            assertTrue(selection.entries().get("a").hasWildcard());
        }
    }

    @Nested
    @DisplayName("Merging repeated fields")
    class MergeTests {

        @Test
        @DisplayName("Should merge repeated groups of the same field")
        void shouldMergeRepeatedGroups() {
            assertEquals(parseValid("a(b,c)"), parseValid("a(b),a(c)"));
        }

        @Test
        @DisplayName("Should merge slash chains sharing a prefix")
        void shouldMergeSlashChains() {
            assertEquals(parseValid("a(b(c,d),e)"), parseValid("a/b/c,a/b/d,a/e"));
        }

        @Test
        @DisplayName("Should merge slash chain with explicit group")
        void shouldMergeSlashWithGroup() {
            assertEquals(parseValid("a(b(c),d)"), parseValid("a(d),a/b/c"));
        }

        @Test
        @DisplayName("Should produce equal trees regardless of order")
        void shouldBeOrderIndependent() {
            assertEquals(parseValid("a(b),a(c)"), parseValid("a(c),a(b)"));
        }

        @Test
        @DisplayName("Should keep a single entry for a duplicated field")
        void shouldKeepSingleEntry() {
            Selection selection = parseValid("a,a,a");

            assertEquals(1, selection.entries().size());
        }

        @ParameterizedTest
        @ValueSource(strings = {"a,a(b)", "a(b),a", "a/b,a", "a,a/b/c"})
        @DisplayName("Should keep a field selected as a whole unrestricted")
        void shouldKeepWholeFieldUnrestricted(String selector) {
            Selection selection = parseValid(selector);

            assertTrue(selection.entries().get("a").isEmpty());
            assertEquals(parseValid("a"), selection);
        }

        @Test
        @DisplayName("Should keep a nested whole field unrestricted")
        void shouldKeepNestedWholeField() {
            assertEquals(parseValid("a(b,c)"), parseValid("a(b(x)),a(b,c)"));
        }

        @Test
        @DisplayName("Should OR wildcard flags of merged groups")
        void shouldOrWildcards() {
            Selection selection = parseValid("a(b),a(*)");

            Selection a = selection.entries().get("a");
            assertTrue(a.hasWildcard());
            assertTrue(a.entries().containsKey("b"));
        }
    }

    @Nested
    @DisplayName("Wildcard")
    class WildcardTests {

        @Test
        @DisplayName("Should set the wildcard flag without storing an entry")
        void shouldSetWildcardFlag() {
            Selection selection = parseValid("*");

            assertTrue(selection.hasWildcard());
            assertTrue(selection.entries().isEmpty());
            assertFalse(selection.isEmpty());
        }

        @Test
        @DisplayName("Should combine wildcard with explicit siblings")
        void shouldCombineWithSiblings() {
            Selection selection = parseValid("a(b),*");

            assertTrue(selection.hasWildcard());
            assertEquals(Map.of("a", parseValid("b")), selection.entries());
        }

        @Test
        @DisplayName("Should treat a name containing a star as a regular field")
        void shouldTreatStarredNameAsField() {
            Selection selection = parseValid("a*");

            assertTrue(selection.entries().containsKey("a*"));
            assertFalse(selection.hasWildcard());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrorTests {

        @ParameterizedTest
        @ValueSource(strings = {"a,,b", "a(b", ")", "/a", ",", "a,", "a()", "(a)", "a(b,)", "a/", "a/,b",
                "a)", "a(b))", "a(b)c", "*(a)", "*/a", "a(,b)", "a((b))", "a//b"})
        @DisplayName("Should report malformed selectors as errors")
        void shouldReportMalformedSelectors(String selector) {
            ParseResult result = assertDoesNotThrow(() -> parser.parse(selector));

            assertTrue(result.isError(), () -> "Expected an error for '" + selector + "' but got " + result);
            assertTrue(result.selection().isEmpty(), "No partial selection may escape");
            assertFalse(result.error().orElseThrow().message().isBlank());
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "a,,b    | 2",
                ")       | 0",
                "/a      | 0",
                "(a)     | 0",
                "a()     | 2",
                "a(b)c   | 4",
                "a(b     | 3",
                "a/      | 2",
                "x,y)    | 3"
        })
        @DisplayName("Should report the offset of the first violation")
        void shouldReportPosition(String selector, int position) {
            ParseResult.Error error = parser.parse(selector).error().orElseThrow();

            assertEquals(position, error.position(), error::message);
        }

        @Test
        @DisplayName("Should describe unbalanced parentheses")
        void shouldDescribeUnbalancedParentheses() {
            assertTrue(parser.parse("a(b").error().orElseThrow().message().contains("Unbalanced '('"));
            assertTrue(parser.parse("a)").error().orElseThrow().message().contains("Unbalanced ')'"));
        }

        @Test
        @DisplayName("Should describe empty field names")
        void shouldDescribeEmptyFieldNames() {
            assertTrue(parser.parse("a,,b").error().orElseThrow().message().contains("Empty field name"));
        }

        @Test
        @DisplayName("Should describe misplaced slash and parenthesis")
        void shouldDescribeMisplacedPunctuation() {
            assertTrue(parser.parse("/a").error().orElseThrow().message().contains("'/' must be preceded"));
            assertTrue(parser.parse("(a)").error().orElseThrow().message().contains("'(' must be preceded"));
            assertTrue(parser.parse("a/").error().orElseThrow().message().contains("must be followed by a field name"));
        }
    }

    @Nested
    @DisplayName("Determinism and rendering")
    class DeterminismTests {

        @Test
        @DisplayName("Should yield structurally equal trees for the same input")
        void shouldBeDeterministic() {
            BasicSelectorParser uncached = new BasicSelectorParser(SelectorPolicy.defaults(), CachePolicy.none());

            Selection first = uncached.parse("kind,items(title,id),meta/etag").selection().orElseThrow();
            Selection second = uncached.parse("kind,items(title,id),meta/etag").selection().orElseThrow();

            assertNotSame(first, second);
            assertEquals(first, second);
            assertEquals(first.hashCode(), second.hashCode());
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "a,b", "a(b,c),d", "a/b/c", "a(b),a(c),*", "x(*),y(z(w))"})
        @DisplayName("Should render a selection that parses back to an equal tree")
        void shouldRoundTripCanonicalRendering(String selector) {
            Selection selection = parseValid(selector);

            assertEquals(selection, parseValid(selection.toString()));
        }

        @Test
        @DisplayName("Should render merged selections canonically")
        void shouldRenderCanonically() {
            assertEquals("a(b(c,d),e),*", parseValid("a/b/c, a/b/d, *, a/e").toString());
        }
    }
}
