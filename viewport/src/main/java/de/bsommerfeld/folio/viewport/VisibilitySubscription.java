package de.bsommerfeld.folio.viewport;

/**
 * Handle to an active visibility subscription. Owned by exactly one tracker,
 * which must close it when it registers a new one or shuts down.
 */
public interface VisibilitySubscription extends AutoCloseable {

    /** Stops observing a single element. Unknown ids are ignored. */
    void unobserve(String elementId);

    /** Whether the subscription still delivers signals. */
    boolean isActive();

    /** Stops all delivery. Idempotent. */
    @Override
    void close();
}
