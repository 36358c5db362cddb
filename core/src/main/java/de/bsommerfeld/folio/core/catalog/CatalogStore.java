package de.bsommerfeld.folio.core.catalog;

import de.bsommerfeld.folio.core.domain.Entry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog for the lifetime of a session. Holds the filterable
 * project entries, the static credential entries and the {@link TagIndex}
 * derived from the projects.
 *
 * <p>
 * Element identities ({@link Entry#elementId()}) must be unique across both
 * lists, since the reveal tracker keys its state by them.
 */
public final class CatalogStore {

    private final List<Entry> entries;
    private final List<Entry> credentials;
    private final TagIndex tagIndex;
    private final Map<String, Entry> byTitle = new HashMap<>();

    public CatalogStore(List<Entry> entries, List<Entry> credentials) {
        this.entries = List.copyOf(entries);
        this.credentials = List.copyOf(credentials);
        this.tagIndex = TagIndex.of(this.entries);

        Map<String, String> elementIds = new HashMap<>();
        for (Entry entry : this.entries) {
            index(entry, elementIds);
        }
        for (Entry entry : this.credentials) {
            index(entry, elementIds);
        }
    }

    public CatalogStore(List<Entry> entries) {
        this(entries, List.of());
    }

    private void index(Entry entry, Map<String, String> elementIds) {
        if (byTitle.putIfAbsent(entry.title(), entry) != null) {
            throw new CatalogException("Duplicate catalog title: " + entry.title());
        }
        String clash = elementIds.putIfAbsent(entry.elementId(), entry.title());
        if (clash != null) {
            throw new CatalogException("Titles '" + clash + "' and '" + entry.title()
                    + "' map to the same element id " + entry.elementId());
        }
    }

    /** Filterable entries in catalog order. */
    public List<Entry> entries() {
        return entries;
    }

    /** Credential entries, rendered in their own section and never filtered. */
    public List<Entry> credentials() {
        return credentials;
    }

    public TagIndex tagIndex() {
        return tagIndex;
    }

    public Optional<Entry> findByTitle(String title) {
        return Optional.ofNullable(byTitle.get(title));
    }

    public int size() {
        return entries.size();
    }
}
