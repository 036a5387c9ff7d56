package io.github.cyfko.partialresponse.core.projection;

import io.github.cyfko.partialresponse.core.matching.SelectionMatcher;
import io.github.cyfko.partialresponse.core.model.FieldsResolution;
import io.github.cyfko.partialresponse.core.model.Selection;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a {@link Selection} to an in-memory object graph before it is handed to a serializer.
 *
 * <p>
 * The graph is made of {@link Map}s (objects), {@link Iterable}s and Java arrays (arrays) and anything else
 * (scalars), which is the shape produced by generic row mappers and by {@code ObjectMapper.convertValue(x, Map.class)}.
 * The result is a new graph of {@link LinkedHashMap}s and {@link ArrayList}s; the input is never modified and
 * scalars are shared.
 * </p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A property is kept when its path is selected (see {@link SelectionMatcher}).</li>
 *   <li>A kept object or array is emitted even if none of its own properties survives: selecting {@code a(b)}
 *       keeps {@code a} as the container leading to {@code b}.</li>
 *   <li>Array elements are transparent: every element is projected with the selection of the array itself.</li>
 *   <li>Below a field selected without sub-selection, values are returned untouched.</li>
 * </ul>
 *
 * <pre>{@code
 * Map<String, Object> body = Map.of(
 *     "kind", "list",
 *     "items", List.of(Map.of("title", "t", "id", 1, "extra", "x")));
 *
 * Object projected = ObjectGraphProjector.project(body, parser.parse("kind,items(title,id)").orElseThrow(), false);
 * // {kind=list, items=[{title=t, id=1}]}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ObjectGraphProjector {

    private ObjectGraphProjector() {}

    /**
     * @param root       the graph to project
     * @param selection  the selection to apply; the empty selection returns {@code root} as is
     * @param ignoreCase whether names are compared case-insensitively
     * @return the projected graph
     */
    public static Object project(Object root, Selection selection, boolean ignoreCase) {
        Objects.requireNonNull(selection, "selection");
        return projectValue(root, selection, ignoreCase);
    }

    /**
     * @param root       the graph to project
     * @param resolution the resolved fields of the request
     * @return the projected graph, or {@code root} itself unless the resolution is filtering
     * @throws IllegalStateException if the request was rejected
     */
    public static Object project(Object root, FieldsResolution resolution) {
        Objects.requireNonNull(resolution, "resolution");
        if (resolution.isRejected()) {
            throw new IllegalStateException("Rejected request must not be serialized");
        }
        if (!resolution.isFiltering()) {
            return root;
        }
        return projectValue(root, resolution.selection().orElseThrow(), resolution.ignoreCase());
    }

    private static Object projectValue(Object value, Selection node, boolean ignoreCase) {
        if (value == null || node.isEmpty()) {
            return value;
        }
        if (value instanceof Map) {
            return projectObject((Map<?, ?>) value, node, ignoreCase);
        }
        if (value instanceof Iterable) {
            List<Object> elements = new ArrayList<>();
            for (Object element : (Iterable<?>) value) {
                elements.add(projectValue(element, node, ignoreCase));
            }
            return elements;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(projectValue(Array.get(value, i), node, ignoreCase));
            }
            return elements;
        }
        return value;
    }

    private static Map<String, Object> projectObject(Map<?, ?> object, Selection node, boolean ignoreCase) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : object.entrySet()) {
            String name = String.valueOf(entry.getKey());
            Selection child = SelectionMatcher.descend(node, name, ignoreCase);
            if (child != null) {
                projected.put(name, projectValue(entry.getValue(), child, ignoreCase));
            }
        }
        return projected;
    }
}
