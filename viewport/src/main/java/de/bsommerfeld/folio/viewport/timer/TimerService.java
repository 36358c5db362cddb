package de.bsommerfeld.folio.viewport.timer;

/**
 * Schedules one-shot callbacks on the UI loop. The owner closes it when the
 * loop is no longer needed; pending callbacks are dropped.
 */
public interface TimerService extends AutoCloseable {

    TimerHandle schedule(long delayMs, Runnable callback);

    @Override
    void close();
}
