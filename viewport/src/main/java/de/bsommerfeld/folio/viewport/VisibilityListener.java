package de.bsommerfeld.folio.viewport;

import java.util.List;

/**
 * Receives batched visibility signals. The host calls it on the UI loop,
 * one batch at a time, with signals in delivery order.
 */
@FunctionalInterface
public interface VisibilityListener {

    void onSignals(List<VisibilitySignal> batch);
}
