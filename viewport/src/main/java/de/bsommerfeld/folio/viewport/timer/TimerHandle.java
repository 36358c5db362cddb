package de.bsommerfeld.folio.viewport.timer;

/**
 * Handle to a scheduled one-shot callback.
 */
public interface TimerHandle {

    /** Prevents the callback from running if it has not run yet. Idempotent. */
    void cancel();

    /** {@code true} until the callback has run or the timer was cancelled. */
    boolean isPending();
}
