package de.bsommerfeld.folio.core.catalog;

import de.bsommerfeld.folio.core.domain.Entry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Distinct tags across a set of entries, in first-seen order. The sentinel
 * {@link #ALL} is always present and always first.
 */
public final class TagIndex {

    /** Tag value that matches every entry. */
    public static final String ALL = "All";

    private final List<String> tags;

    private TagIndex(List<String> tags) {
        this.tags = tags;
    }

    public static TagIndex of(List<Entry> entries) {
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(ALL);
        for (Entry entry : entries) {
            ordered.addAll(entry.tags());
        }
        return new TagIndex(List.copyOf(ordered));
    }

    /** All tags, {@link #ALL} first. */
    public List<String> tags() {
        return tags;
    }

    public boolean contains(String tag) {
        return tags.contains(tag);
    }

    public int size() {
        return tags.size();
    }

    @Override
    public String toString() {
        return "TagIndex" + tags;
    }
}
