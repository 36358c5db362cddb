package de.bsommerfeld.folio.core.domain;

import java.util.Locale;

/**
 * How an {@link EntryLink} is acted upon when the user activates it.
 */
public enum LinkKind {

    /** Opens the detail overlay for the owning entry. */
    DETAIL,

    /** Navigates to an external target outside the browser. */
    EXTERNAL;

    /**
     * Resolves the catalog spelling ({@code "detail"}, {@code "external"}).
     *
     * @throws IllegalArgumentException for any other value
     */
    public static LinkKind fromCatalogName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Link kind must not be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "detail":
            case "modal":
                return DETAIL;
            case "external":
            case "link":
                return EXTERNAL;
            default:
                throw new IllegalArgumentException("Unknown link kind: " + name);
        }
    }
}
