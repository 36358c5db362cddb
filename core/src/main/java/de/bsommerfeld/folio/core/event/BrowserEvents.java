package de.bsommerfeld.folio.core.event;

import de.bsommerfeld.folio.core.domain.Entry;
import de.bsommerfeld.folio.core.filter.FilterState;

import java.util.List;

/**
 * State changes published by the browser core. The host listens for these to
 * update presentation; none of them carries mutable state.
 */
public class BrowserEvents {

    /** A revealable element finished its one-way pending to revealed transition. */
    public record ElementRevealedEvent(String elementId) {
    }

    /** The landmark used for navigation highlighting changed. */
    public record ActiveLandmarkChangedEvent(String previous, String current) {
    }

    /**
     * The detail overlay selection changed. {@code selected} is {@code null}
     * once the overlay is closed.
     */
    public record SelectionChangedEvent(Entry selected) {
    }

    /** A new filter was applied; {@code visible} is the rendered entry list. */
    public record FilterAppliedEvent(FilterState state, List<Entry> visible) {
    }
}
