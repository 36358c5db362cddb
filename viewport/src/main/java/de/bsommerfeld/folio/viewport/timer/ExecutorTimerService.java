package de.bsommerfeld.folio.viewport.timer;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerService} backed by a single daemon thread. All callbacks run
 * on that thread, one after another, so it doubles as the UI loop for
 * timer-driven work.
 */
@Singleton
public class ExecutorTimerService implements TimerService {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorTimerService.class);

    public static final String THREAD_NAME = "folio-ui-loop";

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, THREAD_NAME);
        t.setDaemon(true);
        return t;
    });

    @Override
    public TimerHandle schedule(long delayMs, Runnable callback) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOG.error("Timer callback failed", e);
            }
        }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public void close() {
        LOG.debug("Shutting down {}", THREAD_NAME);
        scheduler.shutdownNow();
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    private record FutureHandle(ScheduledFuture<?> future) implements TimerHandle {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isPending() {
            return !future.isDone();
        }
    }
}
