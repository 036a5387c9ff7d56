package io.github.cyfko.partialresponse.jackson;

import com.fasterxml.jackson.core.filter.TokenFilter;
import io.github.cyfko.partialresponse.core.matching.SelectionMatcher;
import io.github.cyfko.partialresponse.core.model.Selection;

import java.util.Objects;

/**
 * Jackson {@link TokenFilter} driven by a {@link Selection}.
 *
 * <p>
 * Each filter instance stands for one level of the selection. Properties resolve through
 * {@link SelectionMatcher#descend(Selection, String, boolean)}: excluded properties map to {@code null}, fully
 * selected ones to {@link TokenFilter#INCLUDE_ALL}, restricted ones to a filter for the sub-selection. Array
 * elements keep the filter of the array.
 * </p>
 *
 * <p>
 * Meant to be used with {@link TokenFilter.Inclusion#INCLUDE_ALL_AND_PATH} so that the objects leading to a selected
 * property are written. Matched containers are kept even when nothing inside them is selected.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SelectionTokenFilter extends TokenFilter {

    private final Selection selection;
    private final boolean ignoreCase;

    protected SelectionTokenFilter(Selection selection, boolean ignoreCase) {
        this.selection = selection;
        this.ignoreCase = ignoreCase;
    }

    /**
     * @param selection  the root selection
     * @param ignoreCase whether names are compared case-insensitively
     * @return {@link TokenFilter#INCLUDE_ALL} for the empty selection, a selection filter otherwise
     */
    public static TokenFilter of(Selection selection, boolean ignoreCase) {
        Objects.requireNonNull(selection, "selection");
        return selection.isEmpty() ? TokenFilter.INCLUDE_ALL : new SelectionTokenFilter(selection, ignoreCase);
    }

    public Selection getSelection() {
        return selection;
    }

    @Override
    public TokenFilter includeProperty(String name) {
        Selection child = SelectionMatcher.descend(selection, name, ignoreCase);
        if (child == null) {
            return null;
        }
        return of(child, ignoreCase);
    }

    @Override
    public TokenFilter includeElement(int index) {
        return this;
    }

    @Override
    public boolean includeEmptyObject(boolean contentsFiltered) {
        return true;
    }

    @Override
    public boolean includeEmptyArray(boolean contentsFiltered) {
        return true;
    }

    @Override
    public String toString() {
        return "SelectionTokenFilter[" + selection + "]";
    }
}
