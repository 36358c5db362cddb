package de.bsommerfeld.folio.core.event;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.folio.core.event.BrowserEvents.ActiveLandmarkChangedEvent;
import de.bsommerfeld.folio.core.event.BrowserEvents.ElementRevealedEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<ElementRevealedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onRevealed(ElementRevealedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new ElementRevealedEvent("entry/ozark"));

        assertEquals("entry/ozark", received.get().elementId());
    }

    @Test
    void post_shouldOnlyDeliverMatchingEventTypes() {
        var eventBus = new ApplicationEventBus();
        List<Object> received = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onLandmark(ActiveLandmarkChangedEvent event) {
                received.add(event);
            }
        };
        eventBus.register(listener);

        eventBus.post(new ElementRevealedEvent("entry/ozark"));
        eventBus.post(new ActiveLandmarkChangedEvent("home", "projects"));

        assertEquals(List.of(new ActiveLandmarkChangedEvent("home", "projects")), received);
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post("first");
        eventBus.unregister(listener);
        eventBus.post("second");

        assertEquals("first", received.get());
    }

    @Test
    void post_shouldNotThrowForUnhandledEvents() {
        var eventBus = new ApplicationEventBus();
        assertDoesNotThrow(() -> eventBus.post("nobody-listens"));
    }

    @Test
    void post_withFailingListener_shouldStillReachOtherListeners() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<ElementRevealedEvent>();

        eventBus.register(new Object() {
            @Subscribe
            public void onRevealed(ElementRevealedEvent event) {
                throw new IllegalStateException("host failed to animate");
            }
        });
        eventBus.register(new Object() {
            @Subscribe
            public void onRevealed(ElementRevealedEvent event) {
                received.set(event);
            }
        });

        assertDoesNotThrow(() -> eventBus.post(new ElementRevealedEvent("entry/ozark")));
        assertEquals("entry/ozark", received.get().elementId());
    }
}
