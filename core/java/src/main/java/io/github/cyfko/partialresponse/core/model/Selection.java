package io.github.cyfko.partialresponse.core.model;

import java.util.*;

/**
 * Immutable tree of selected fields parsed from a selector such as {@code kind,items(title,id),meta/etag}.
 *
 * <p>
 * Each node maps field names (original case preserved) to nested selections and records whether a
 * wildcard ({@code *}) was present among its entries. A nested selection without entries and without
 * wildcard is a leaf: the field is selected as a whole, with no restriction below it.
 * </p>
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li><strong>Empty selection</strong>: "no filtering requested". Matching against it selects everything.</li>
 *   <li><strong>Wildcard</strong>: any field not listed at that level is selected, recursively.</li>
 *   <li><strong>Merge</strong>: selecting the same field twice unions the sub-selections
 *       ({@code a(b),a(c)} equals {@code a(b,c)}); wildcard flags are OR'd. A field selected as a whole
 *       stays whole ({@code a,a(b)} equals {@code a}).</li>
 * </ul>
 *
 * <h2>Lookups</h2>
 * <p>
 * Child lookup is hash based. Case-insensitive lookups go through an index keyed by
 * {@link Locale#ROOT} lower-cased names, built once at construction; stored names are never rewritten.
 * When several stored names fold to the same key ({@code Name} and {@code name}), the index holds their
 * merged sub-selection.
 * </p>
 *
 * <p>Instances are deeply immutable and may be shared across threads without synchronization.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Selection {

    private static final Selection EMPTY = new Selection(Map.of(), false);

    private final Map<String, Selection> entries;
    private final Map<String, Selection> foldedEntries;
    private final boolean wildcard;

    private Selection(Map<String, Selection> entries, boolean wildcard) {
        this.entries = entries;
        this.wildcard = wildcard;
        this.foldedEntries = foldEntries(entries);
    }

    /**
     * @return the shared "select everything" selection
     */
    public static Selection empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return unmodifiable, insertion-ordered view of the selected fields
     */
    public Map<String, Selection> entries() {
        return entries;
    }

    public boolean hasWildcard() {
        return wildcard;
    }

    /**
     * @return {@code true} when nothing is restricted at all (no entries and no wildcard)
     */
    public boolean isEmpty() {
        return entries.isEmpty() && !wildcard;
    }

    /**
     * Looks up the sub-selection of a field.
     *
     * @param name       the field name as produced by the serializer
     * @param ignoreCase whether names are compared case-insensitively
     * @return the sub-selection, or {@code null} if the field is not listed at this level
     */
    public Selection get(String name, boolean ignoreCase) {
        if (ignoreCase) {
            return foldedEntries.get(fold(name));
        }
        return entries.get(name);
    }

    /**
     * Maximum nesting depth of this tree: 0 for a flat list of fields, 1 for {@code a(b)}, and so on.
     *
     * @return nesting depth
     */
    public int depth() {
        int depth = 0;
        for (Selection child : entries.values()) {
            if (!child.entries.isEmpty() || child.wildcard) {
                depth = Math.max(depth, 1 + child.depth());
            }
        }
        return depth;
    }

    /**
     * Recursive union of two selections. The empty selection selects everything, so it absorbs the other
     * operand: {@code a} merged with {@code a(b)} is {@code a}.
     *
     * @param other the selection to merge with this one
     * @return a selection containing the fields of both
     */
    public Selection merge(Selection other) {
        Objects.requireNonNull(other, "other");
        if (this.isEmpty() || other.isEmpty()) return EMPTY;
        return new Builder().merge(this).merge(other).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selection)) return false;
        Selection that = (Selection) o;
        return wildcard == that.wildcard && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, wildcard);
    }

    /**
     * Renders the selection back to canonical selector syntax, e.g. {@code a(b,c),d,*}.
     * The rendering parses back into an equal selection.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    private void render(StringBuilder sb) {
        boolean first = true;
        for (Map.Entry<String, Selection> entry : entries.entrySet()) {
            if (!first) sb.append(',');
            first = false;
            sb.append(entry.getKey());
            Selection child = entry.getValue();
            if (!child.isEmpty()) {
                sb.append('(');
                child.render(sb);
                sb.append(')');
            }
        }
        if (wildcard) {
            if (!first) sb.append(',');
            sb.append('*');
        }
    }

    private static Map<String, Selection> foldEntries(Map<String, Selection> entries) {
        if (entries.isEmpty()) {
            return Map.of();
        }
        Map<String, Selection> folded = new HashMap<>(entries.size() * 2);
        for (Map.Entry<String, Selection> entry : entries.entrySet()) {
            folded.merge(fold(entry.getKey()), entry.getValue(), Selection::merge);
        }
        return Collections.unmodifiableMap(folded);
    }

    private static String fold(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Mutable accumulator used while parsing. Selecting a field that is already present returns the existing
     * child builder, which is what gives repeated selectors their union semantics. A field selected as a whole
     * ({@link #leaf(String)}) absorbs any restriction added to it before or after.
     */
    public static final class Builder {
        private final Map<String, Builder> entries = new LinkedHashMap<>();
        private boolean wildcard;
        private boolean whole;

        private Builder() {}

        /**
         * Selects a field at this level, to be restricted through the returned builder.
         *
         * @param name the field name, stored as given
         * @return the builder of the field's sub-selection
         */
        public Builder field(String name) {
            Objects.requireNonNull(name, "name");
            return entries.computeIfAbsent(name, k -> new Builder());
        }

        /**
         * Selects a field as a whole, with no restriction below it.
         *
         * @param name the field name, stored as given
         * @return this builder
         */
        public Builder leaf(String name) {
            field(name).whole = true;
            return this;
        }

        public Builder wildcard() {
            this.wildcard = true;
            return this;
        }

        /**
         * Adds every field of an already built selection to this level. Merging the empty selection makes this
         * level whole.
         *
         * @param selection the selection to fold in
         * @return this builder
         */
        public Builder merge(Selection selection) {
            Objects.requireNonNull(selection, "selection");
            if (selection.isEmpty()) {
                this.whole = true;
                return this;
            }
            this.wildcard |= selection.wildcard;
            for (Map.Entry<String, Selection> entry : selection.entries.entrySet()) {
                field(entry.getKey()).merge(entry.getValue());
            }
            return this;
        }

        public Selection build() {
            if (whole || (entries.isEmpty() && !wildcard)) {
                return EMPTY;
            }
            Map<String, Selection> built = new LinkedHashMap<>(entries.size() * 2);
            for (Map.Entry<String, Builder> entry : entries.entrySet()) {
                built.put(entry.getKey(), entry.getValue().build());
            }
            return new Selection(Collections.unmodifiableMap(built), wildcard);
        }
    }
}
