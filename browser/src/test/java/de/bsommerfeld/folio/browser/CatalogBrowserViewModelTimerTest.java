package de.bsommerfeld.folio.browser;

import com.google.common.util.concurrent.Uninterruptibles;
import de.bsommerfeld.folio.browser.host.HeadlessHost;
import de.bsommerfeld.folio.browser.overlay.DetailOverlayController;
import de.bsommerfeld.folio.core.catalog.CatalogLoader;
import de.bsommerfeld.folio.core.catalog.CatalogStore;
import de.bsommerfeld.folio.core.config.BrowserConfig;
import de.bsommerfeld.folio.core.event.ApplicationEventBus;
import de.bsommerfeld.folio.core.filter.FilterEngine;
import de.bsommerfeld.folio.viewport.FakeVisibilityHost;
import de.bsommerfeld.folio.viewport.reveal.RevealTracker;
import de.bsommerfeld.folio.viewport.section.SectionActivityTracker;
import de.bsommerfeld.folio.viewport.timer.ExecutorTimerService;
import de.bsommerfeld.folio.viewport.timer.TimerHandle;
import de.bsommerfeld.folio.viewport.timer.TimerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the view model against the real loop thread, with the first timer
 * callback held at a gate so a filter change can land while it is running.
 */
class CatalogBrowserViewModelTimerTest {

    private static final long SETTLE_DELAY_MS = 300;

    private final GatedTimerService timers = new GatedTimerService();
    private FakeVisibilityHost host;
    private CatalogBrowserViewModel viewModel;

    @BeforeEach
    void setUp() {
        BrowserConfig config = new BrowserConfig();
        config.setRevealSettleDelayMs(SETTLE_DELAY_MS);
        CatalogStore catalog = new CatalogLoader().loadDefault();
        ApplicationEventBus eventBus = new ApplicationEventBus();
        HeadlessHost actions = new HeadlessHost();

        host = new FakeVisibilityHost();
        host.render(config.getLandmarks());
        host.render(config.getRevealElements());
        catalog.entries().forEach(e -> host.render(e.elementId()));
        catalog.credentials().forEach(e -> host.render(e.elementId()));

        viewModel = new CatalogBrowserViewModel(catalog, new FilterEngine(),
                new RevealTracker(host, eventBus, config),
                new SectionActivityTracker(host, eventBus, config),
                new DetailOverlayController(actions, eventBus, config),
                timers, actions, actions, actions, eventBus, config);
    }

    @AfterEach
    void tearDown() {
        timers.gate.countDown();
        viewModel.close();
    }

    @Test
    void supersededCallback_shouldKeepNewerRegistrationPending() throws InterruptedException {
        viewModel.mount();

        viewModel.setActiveTag("Python");
        assertTrue(timers.firstStarted.await(2, TimeUnit.SECONDS));

        viewModel.setActiveTag("React");
        timers.gate.countDown();
        assertTrue(timers.firstFinished.await(2, TimeUnit.SECONDS));

        assertTrue(viewModel.hasPendingRegistration());
        // section + initial reveal subscription, the superseded callback added none
        assertEquals(2, host.subscriptions().size());
    }

    @Test
    void close_afterSupersededCallback_shouldNotResubscribe() throws InterruptedException {
        viewModel.mount();
        viewModel.setActiveTag("Python");
        assertTrue(timers.firstStarted.await(2, TimeUnit.SECONDS));
        viewModel.setActiveTag("React");
        timers.gate.countDown();
        assertTrue(timers.firstFinished.await(2, TimeUnit.SECONDS));

        viewModel.close();
        Thread.sleep(SETTLE_DELAY_MS * 2);

        assertTrue(host.activeSubscriptions().isEmpty());
        assertEquals(2, host.subscriptions().size());
        assertTrue(timers.delegate.isShutdown());
    }

    @Test
    void close_whileCallbackRuns_shouldNotRegister() throws InterruptedException {
        viewModel.mount();
        viewModel.setActiveTag("Python");
        assertTrue(timers.firstStarted.await(2, TimeUnit.SECONDS));

        viewModel.close();
        timers.gate.countDown();
        assertTrue(timers.firstFinished.await(2, TimeUnit.SECONDS));

        assertTrue(host.activeSubscriptions().isEmpty());
        assertEquals(2, host.subscriptions().size());
    }

    private static final class GatedTimerService implements TimerService {

        private final ExecutorTimerService delegate = new ExecutorTimerService();
        private final AtomicInteger scheduled = new AtomicInteger();
        private final CountDownLatch firstStarted = new CountDownLatch(1);
        private final CountDownLatch gate = new CountDownLatch(1);
        private final CountDownLatch firstFinished = new CountDownLatch(1);

        @Override
        public TimerHandle schedule(long delayMs, Runnable callback) {
            if (scheduled.getAndIncrement() > 0) {
                return delegate.schedule(delayMs, callback);
            }
            return delegate.schedule(delayMs, () -> {
                firstStarted.countDown();
                // close() interrupts the loop thread, the callback must still run
                Uninterruptibles.awaitUninterruptibly(gate);
                try {
                    callback.run();
                } finally {
                    firstFinished.countDown();
                }
            });
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
