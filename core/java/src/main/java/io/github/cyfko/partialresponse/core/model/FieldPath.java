package io.github.cyfko.partialresponse.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable path from the serialized root to a candidate property.
 *
 * <p>
 * Paths are usually built incrementally by a serializer walking an object graph
 * ({@link #property(String)}, {@link #element(int)}), or parsed from the notation JSON serializers use to
 * report positions:
 * </p>
 * <pre>{@code
 * FieldPath.parse("items[0].title");     // items, [0], title
 * FieldPath.parse("[2].name");           // [2], name
 * FieldPath.parse("meta['content.type']") // meta, content.type
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FieldPath {

    private static final FieldPath ROOT = new FieldPath(List.of());

    private final List<PathSegment> segments;

    private FieldPath(List<PathSegment> segments) {
        this.segments = segments;
    }

    public static FieldPath root() {
        return ROOT;
    }

    /**
     * @param names property names from the root down
     * @return a path made of property segments only
     */
    public static FieldPath of(String... names) {
        List<PathSegment> segments = new ArrayList<>(names.length);
        for (String name : names) {
            segments.add(PathSegment.property(name));
        }
        return new FieldPath(Collections.unmodifiableList(segments));
    }

    public static FieldPath of(List<PathSegment> segments) {
        Objects.requireNonNull(segments, "segments");
        return segments.isEmpty() ? ROOT : new FieldPath(List.copyOf(segments));
    }

    /**
     * Parses dotted and indexed path notation.
     *
     * @param path the path text; blank means the root
     * @return the parsed path
     * @throws IllegalArgumentException if the text is not a well-formed path
     */
    public static FieldPath parse(String path) {
        Objects.requireNonNull(path, "path");
        List<PathSegment> segments = new ArrayList<>();
        int length = path.length();
        int i = 0;
        while (i < length) {
            char c = path.charAt(i);
            if (c == '.') {
                if (i == 0 || i == length - 1 || path.charAt(i + 1) == '.') {
                    throw new IllegalArgumentException("Misplaced '.' at position " + i + " in path: " + path);
                }
                i++;
            } else if (c == '[') {
                i = parseBracket(path, i, segments);
            } else {
                int start = i;
                while (i < length && path.charAt(i) != '.' && path.charAt(i) != '[') {
                    i++;
                }
                segments.add(PathSegment.property(path.substring(start, i)));
            }
        }
        return segments.isEmpty() ? ROOT : new FieldPath(Collections.unmodifiableList(segments));
    }

    private static int parseBracket(String path, int open, List<PathSegment> segments) {
        int close = path.indexOf(']', open);
        if (close < 0) {
            throw new IllegalArgumentException("Unclosed '[' at position " + open + " in path: " + path);
        }
        String content = path.substring(open + 1, close);
        if (content.length() >= 2 && content.charAt(0) == '\'' && content.charAt(content.length() - 1) == '\'') {
            segments.add(PathSegment.property(content.substring(1, content.length() - 1)));
            return close + 1;
        }
        try {
            segments.add(PathSegment.element(Integer.parseInt(content)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid array index '" + content + "' in path: " + path, e);
        }
        return close + 1;
    }

    public FieldPath property(String name) {
        return append(PathSegment.property(name));
    }

    public FieldPath element(int index) {
        return append(PathSegment.element(index));
    }

    private FieldPath append(PathSegment segment) {
        List<PathSegment> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(segment);
        return new FieldPath(Collections.unmodifiableList(extended));
    }

    public List<PathSegment> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath)) return false;
        return segments.equals(((FieldPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PathSegment segment : segments) {
            if (segment.isElement()) {
                sb.append('[').append(segment.index()).append(']');
            } else if (segment.name().indexOf('.') >= 0 || segment.name().indexOf('[') >= 0) {
                sb.append("['").append(segment.name()).append("']");
            } else {
                if (sb.length() > 0) sb.append('.');
                sb.append(segment.name());
            }
        }
        return sb.toString();
    }
}
