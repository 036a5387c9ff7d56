package io.github.cyfko.partialresponse.core.model;

import java.util.Objects;

/**
 * One step of a candidate property path: either a named property or an array element.
 * Array elements are transparent for matching; they never consume a selector token.
 *
 * @param kind  the segment kind
 * @param name  the property name, {@code null} for array elements
 * @param index the element index, {@code -1} for properties
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PathSegment(Kind kind, String name, int index) {

    public enum Kind {
        PROPERTY,
        ARRAY_ELEMENT
    }

    public PathSegment {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.PROPERTY && name == null) {
            throw new IllegalArgumentException("A property segment requires a name");
        }
        if (kind == Kind.ARRAY_ELEMENT && index < 0) {
            throw new IllegalArgumentException("Array index must not be negative, got: " + index);
        }
    }

    public static PathSegment property(String name) {
        return new PathSegment(Kind.PROPERTY, name, -1);
    }

    public static PathSegment element(int index) {
        return new PathSegment(Kind.ARRAY_ELEMENT, null, index);
    }

    public boolean isElement() {
        return kind == Kind.ARRAY_ELEMENT;
    }

    @Override
    public String toString() {
        return isElement() ? "[" + index + "]" : name;
    }
}
