package de.bsommerfeld.folio.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import de.bsommerfeld.folio.core.event.BrowserEvents.ElementRevealedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes browser state changes from the trackers, the overlay controller
 * and the view model to the rendering host. Events are the records in
 * {@link BrowserEvents}; the host registers {@code @Subscribe} methods to
 * animate a revealed card, move the navigation highlight, show or hide the
 * overlay and re-render the card list.
 *
 * <p>
 * Delivery is synchronous on the posting thread. A failing host listener is
 * logged and does not stop delivery to the others or reach the poster.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::onListenerFailure);
    }

    public void post(Object event) {
        // One reveal per card while scrolling, keep those out of debug output
        if (event instanceof ElementRevealedEvent) {
            LOG.trace("Posting event: {}", event);
        } else {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void onListenerFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Listener {} failed on {}", context.getSubscriberMethod(), context.getEvent(), exception);
    }
}
