package de.bsommerfeld.folio.core.filter;

import de.bsommerfeld.folio.core.catalog.CatalogStore;
import de.bsommerfeld.folio.core.catalog.TagIndex;
import de.bsommerfeld.folio.core.domain.Entry;

import java.util.List;
import java.util.Locale;

/**
 * Derives the visible subset of a catalog from a {@link FilterState}.
 *
 * <p>
 * An entry is visible when it matches both the query and the tag:
 * <ul>
 * <li>query: empty after trimming, or a case-insensitive substring of the
 * title, the summary or any tag</li>
 * <li>tag: {@link TagIndex#ALL}, or contained in the entry's tags (exact)</li>
 * </ul>
 * The result keeps catalog order. The most recent result is memoized per
 * catalog and {@code (query, tag)} pair; a hit returns the same list instance.
 */
public class FilterEngine {

    private CatalogStore lastCatalog;
    private String lastQuery;
    private String lastTag;
    private List<Entry> lastResult;

    public List<Entry> apply(CatalogStore catalog, FilterState state) {
        String query = state.normalizedQuery();
        String tag = state.activeTag();
        if (catalog == lastCatalog && query.equals(lastQuery) && tag.equals(lastTag)) {
            return lastResult;
        }

        List<Entry> result = filter(catalog.entries(), query, tag);
        lastCatalog = catalog;
        lastQuery = query;
        lastTag = tag;
        lastResult = result;
        return result;
    }

    /**
     * Uncached filtering over an arbitrary entry list.
     *
     * @param query already trimmed and lower-cased
     */
    public static List<Entry> filter(List<Entry> entries, String query, String tag) {
        return entries.stream()
                .filter(e -> matchesQuery(e, query) && matchesTag(e, tag))
                .toList();
    }

    static boolean matchesQuery(Entry entry, String query) {
        if (query.isEmpty()) {
            return true;
        }
        if (contains(entry.title(), query) || contains(entry.summary(), query)) {
            return true;
        }
        for (String tag : entry.tags()) {
            if (contains(tag, query)) {
                return true;
            }
        }
        return false;
    }

    static boolean matchesTag(Entry entry, String tag) {
        return TagIndex.ALL.equals(tag) || entry.hasTag(tag);
    }

    private static boolean contains(String text, String query) {
        return text.toLowerCase(Locale.ROOT).contains(query);
    }
}
