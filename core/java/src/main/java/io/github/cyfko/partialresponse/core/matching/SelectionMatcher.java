package io.github.cyfko.partialresponse.core.matching;

import io.github.cyfko.partialresponse.core.model.FieldPath;
import io.github.cyfko.partialresponse.core.model.PathSegment;
import io.github.cyfko.partialresponse.core.model.Selection;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether a candidate property path is selected by a {@link Selection}.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>An empty selection selects everything.</li>
 *   <li>Property segments are looked up left to right, descending into the matched sub-selection.</li>
 *   <li>A matched last property segment is selected, whatever restrictions lie below it: the serializer asks
 *       about the children separately.</li>
 *   <li>A matched field whose sub-selection is empty selects everything below it.</li>
 *   <li>An unmatched segment is selected only if the current level carries a wildcard.</li>
 *   <li>Array element segments are transparent: the same level is reused for the next segment, so {@code a(b)}
 *       selects {@code b} in every element of an array {@code a}.</li>
 *   <li>A path without property segments is selected when the root is empty or has a wildcard.</li>
 * </ol>
 *
 * <p>
 * Each call costs O(depth) hash lookups and has no side effects; a selection may be matched from any number of
 * threads. Walkers that visit a tree should prefer {@link #descend(Selection, String, boolean)}, which resolves one
 * level at a time instead of re-matching from the root.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SelectionMatcher {

    private SelectionMatcher() {}

    /**
     * @param selection  the parsed selection
     * @param path       the candidate path, from the serialized root
     * @param ignoreCase whether names are compared case-insensitively
     * @return {@code true} if the property at {@code path} must be serialized
     */
    public static boolean matches(Selection selection, List<PathSegment> path, boolean ignoreCase) {
        Objects.requireNonNull(selection, "selection");
        Objects.requireNonNull(path, "path");

        if (selection.isEmpty()) {
            return true;
        }

        int last = lastPropertyIndex(path);
        if (last < 0) {
            return selection.hasWildcard();
        }

        Selection node = selection;
        for (int i = 0; i <= last; i++) {
            PathSegment segment = path.get(i);
            if (segment.isElement()) {
                continue;
            }

            Selection child = node.get(segment.name(), ignoreCase);
            if (child == null) {
                return node.hasWildcard();
            }
            if (i == last || child.isEmpty()) {
                return true;
            }
            node = child;
        }
        return true;
    }

    public static boolean matches(Selection selection, FieldPath path, boolean ignoreCase) {
        Objects.requireNonNull(path, "path");
        return matches(selection, path.segments(), ignoreCase);
    }

    /**
     * Binds a selection into a path predicate, the form serializer hooks usually expect.
     *
     * @param selection  the parsed selection
     * @param ignoreCase whether names are compared case-insensitively
     * @return a stateless, thread-safe predicate
     */
    public static Predicate<FieldPath> predicate(Selection selection, boolean ignoreCase) {
        Objects.requireNonNull(selection, "selection");
        if (selection.isEmpty()) {
            return path -> true;
        }
        return path -> matches(selection, path, ignoreCase);
    }

    /**
     * Resolves the selection governing a child property of the level {@code node}.
     *
     * @param node       the selection governing the parent object
     * @param name       the child property name
     * @param ignoreCase whether names are compared case-insensitively
     * @return {@code null} if the property is excluded, {@link Selection#empty()} if the property and everything
     *         below it are included, the restricting sub-selection otherwise
     */
    public static Selection descend(Selection node, String name, boolean ignoreCase) {
        Objects.requireNonNull(node, "node");
        if (node.isEmpty()) {
            return node;
        }

        Selection child = node.get(name, ignoreCase);
        if (child != null) {
            return child;
        }
        return node.hasWildcard() ? Selection.empty() : null;
    }

    private static int lastPropertyIndex(List<PathSegment> path) {
        for (int i = path.size() - 1; i >= 0; i--) {
            if (!path.get(i).isElement()) {
                return i;
            }
        }
        return -1;
    }
}
