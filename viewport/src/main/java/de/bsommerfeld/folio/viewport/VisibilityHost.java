package de.bsommerfeld.folio.viewport;

import java.util.Collection;
import java.util.List;

/**
 * Boundary to the rendering surface that measures element visibility.
 * Implementations live with the host; the core only consumes signals.
 */
public interface VisibilityHost {

    /**
     * Whether this host can deliver visibility signals at all. Hosts that
     * cannot are served in a degraded mode: content is revealed at once and
     * the active landmark stays at its initial value.
     */
    boolean supportsVisibilitySignals();

    /** Whether the id currently maps to a rendered element. */
    boolean resolves(String elementId);

    /**
     * Starts observing the given elements. Batches are delivered
     * asynchronously to {@code listener} until the returned subscription is
     * closed.
     *
     * @param elementIds elements to observe, all of which resolve
     * @param thresholds visible fractions at which a signal is emitted
     */
    VisibilitySubscription subscribe(Collection<String> elementIds, List<Double> thresholds,
            VisibilityListener listener);
}
