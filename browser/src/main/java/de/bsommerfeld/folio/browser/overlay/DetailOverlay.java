package de.bsommerfeld.folio.browser.overlay;

import de.bsommerfeld.folio.core.domain.Entry;
import de.bsommerfeld.folio.core.domain.EntryLink;

import java.util.List;

/**
 * Payload of the open detail overlay: the selected entry and the external
 * links listed under its details. Detail links are omitted since the overlay
 * is already showing them.
 */
public record DetailOverlay(Entry entry, List<EntryLink> externalLinks) {

    static DetailOverlay of(Entry entry) {
        return new DetailOverlay(entry, entry.externalLinks());
    }
}
