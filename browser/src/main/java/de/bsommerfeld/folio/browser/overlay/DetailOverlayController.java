package de.bsommerfeld.folio.browser.overlay;

import com.google.inject.Singleton;
import de.bsommerfeld.folio.browser.host.ScrollAction;
import de.bsommerfeld.folio.core.config.BrowserConfig;
import de.bsommerfeld.folio.core.domain.Entry;
import de.bsommerfeld.folio.core.event.ApplicationEventBus;
import de.bsommerfeld.folio.core.event.BrowserEvents.SelectionChangedEvent;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds the single entry shown in the detail overlay, if any.
 *
 * <p>
 * Opening replaces the current selection; overlays never stack. The three
 * close triggers (close button, click outside the content, "back to
 * projects") all clear the selection; the last one also scrolls to the
 * catalog landmark.
 */
@Singleton
public class DetailOverlayController {

    private static final Logger LOG = LoggerFactory.getLogger(DetailOverlayController.class);

    private final ScrollAction scrollAction;
    private final ApplicationEventBus eventBus;
    private final String catalogLandmark;

    private Entry selected;

    @Inject
    public DetailOverlayController(ScrollAction scrollAction, ApplicationEventBus eventBus, BrowserConfig config) {
        this(scrollAction, eventBus, config.getCatalogLandmark());
    }

    public DetailOverlayController(ScrollAction scrollAction, ApplicationEventBus eventBus, String catalogLandmark) {
        this.scrollAction = scrollAction;
        this.eventBus = eventBus;
        this.catalogLandmark = catalogLandmark;
    }

    public void open(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        if (entry.equals(selected)) {
            return;
        }
        LOG.debug("Opening details for '{}'", entry.title());
        selected = entry;
        eventBus.post(new SelectionChangedEvent(entry));
    }

    /** Close button. */
    public void close() {
        clearSelection();
    }

    /** Click or tap outside the overlay content. */
    public void dismissOutside() {
        clearSelection();
    }

    /** "Back to projects": closes and scrolls to the catalog landmark. */
    public void returnToCatalog() {
        clearSelection();
        if (catalogLandmark != null) {
            scrollAction.scrollTo(catalogLandmark);
        }
    }

    public Optional<Entry> selection() {
        return Optional.ofNullable(selected);
    }

    public Optional<DetailOverlay> overlay() {
        return selection().map(DetailOverlay::of);
    }

    public boolean isOpen() {
        return selected != null;
    }

    private void clearSelection() {
        if (selected == null) {
            return;
        }
        LOG.debug("Closing details for '{}'", selected.title());
        selected = null;
        eventBus.post(new SelectionChangedEvent(null));
    }
}
