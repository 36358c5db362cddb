package de.bsommerfeld.folio.core.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable catalog item, either a project or a credential. Tags keep their
 * catalog order; the first four are what a compact card shows.
 *
 * @param title       display title, unique within a catalog
 * @param year        year label as written in the catalog (e.g. {@code "2025"})
 * @param summary     one-line highlight shown on the card
 * @param detailsText longer description shown in the detail overlay
 * @param tags        category tags in catalog order
 * @param primaryTag  tag that drives the card accent, {@code null} if unset
 * @param links       ordered card actions
 */
public record Entry(
        String title,
        String year,
        String summary,
        String detailsText,
        Set<String> tags,
        String primaryTag,
        List<EntryLink> links) {

    private static final String ELEMENT_PREFIX = "entry/";

    public Entry {
        Objects.requireNonNull(title, "title");
        summary = summary == null ? "" : summary;
        detailsText = detailsText == null ? "" : detailsText;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        links = links == null ? List.of() : List.copyOf(links);
    }

    /**
     * Stable identity of the rendered card for this entry. Derived from the
     * title so it survives re-renders and filter changes.
     */
    public String elementId() {
        return ELEMENT_PREFIX + slug(title);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /** Links of kind {@link LinkKind#EXTERNAL}, in catalog order. */
    public List<EntryLink> externalLinks() {
        return links.stream().filter(EntryLink::isExternal).toList();
    }

    static String slug(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean dash = false;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
                dash = false;
            } else if (!dash && sb.length() > 0) {
                sb.append('-');
                dash = true;
            }
        }
        if (dash) {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }
}
