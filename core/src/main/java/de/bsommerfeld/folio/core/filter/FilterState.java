package de.bsommerfeld.folio.core.filter;

import de.bsommerfeld.folio.core.catalog.TagIndex;

import java.util.Locale;

/**
 * Current free-text query and tag selection. Immutable; the owner swaps in a
 * new instance through {@link #withQuery(String)} / {@link #withTag(String)}.
 *
 * @param query     raw query as typed, never {@code null}
 * @param activeTag selected tag, {@link TagIndex#ALL} for no tag filter
 */
public record FilterState(String query, String activeTag) {

    public static final FilterState DEFAULT = new FilterState("", TagIndex.ALL);

    public FilterState {
        query = query == null ? "" : query;
        activeTag = activeTag == null || activeTag.isEmpty() ? TagIndex.ALL : activeTag;
    }

    public FilterState withQuery(String query) {
        return new FilterState(query, activeTag);
    }

    public FilterState withTag(String tag) {
        return new FilterState(query, tag);
    }

    /** Trimmed, lower-cased query used for matching. */
    public String normalizedQuery() {
        return query.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isUnfiltered() {
        return normalizedQuery().isEmpty() && TagIndex.ALL.equals(activeTag);
    }
}
