package de.bsommerfeld.folio.browser;

import com.google.inject.Singleton;
import de.bsommerfeld.folio.browser.host.ClipboardAction;
import de.bsommerfeld.folio.browser.host.ExternalLinkAction;
import de.bsommerfeld.folio.browser.host.ScrollAction;
import de.bsommerfeld.folio.browser.overlay.DetailOverlay;
import de.bsommerfeld.folio.browser.overlay.DetailOverlayController;
import de.bsommerfeld.folio.core.catalog.CatalogStore;
import de.bsommerfeld.folio.core.catalog.TagIndex;
import de.bsommerfeld.folio.core.config.BrowserConfig;
import de.bsommerfeld.folio.core.domain.Entry;
import de.bsommerfeld.folio.core.domain.EntryLink;
import de.bsommerfeld.folio.core.event.ApplicationEventBus;
import de.bsommerfeld.folio.core.event.BrowserEvents.FilterAppliedEvent;
import de.bsommerfeld.folio.core.filter.FilterEngine;
import de.bsommerfeld.folio.core.filter.FilterState;
import de.bsommerfeld.folio.viewport.reveal.RevealTracker;
import de.bsommerfeld.folio.viewport.section.SectionActivityTracker;
import de.bsommerfeld.folio.viewport.timer.TimerHandle;
import de.bsommerfeld.folio.viewport.timer.TimerService;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Model backing the single-page browser. Owns the {@link FilterState} and
 * wires catalog filtering, reveal tracking, landmark tracking and the detail
 * overlay together. All methods are called on the UI loop.
 *
 * <p>
 * A filter change re-renders the entry list immediately and re-registers the
 * reveal tracker after a short settle delay, so the host measures the new
 * layout. Only one such registration is ever pending.
 *
 * <p>
 * Host calls and timer callbacks may arrive on different threads, so every
 * entry point synchronizes on the model. A registration callback that was
 * already running when it got superseded or closed finds a stale round
 * number and does nothing.
 */
@Singleton
public class CatalogBrowserViewModel implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogBrowserViewModel.class);

    private final CatalogStore catalog;
    private final FilterEngine filterEngine;
    private final RevealTracker revealTracker;
    private final SectionActivityTracker sectionTracker;
    private final DetailOverlayController overlayController;
    private final TimerService timerService;
    private final ScrollAction scrollAction;
    private final ClipboardAction clipboardAction;
    private final ExternalLinkAction externalLinkAction;
    private final ApplicationEventBus eventBus;
    private final BrowserConfig config;

    private FilterState filterState = FilterState.DEFAULT;
    private List<Entry> visibleEntries;
    private TimerHandle pendingRegistration;
    private long registrationRound;
    private boolean mounted;
    private boolean closed;

    @Inject
    public CatalogBrowserViewModel(CatalogStore catalog, FilterEngine filterEngine,
            RevealTracker revealTracker, SectionActivityTracker sectionTracker,
            DetailOverlayController overlayController, TimerService timerService,
            ScrollAction scrollAction, ClipboardAction clipboardAction,
            ExternalLinkAction externalLinkAction, ApplicationEventBus eventBus,
            BrowserConfig config) {
        this.catalog = catalog;
        this.filterEngine = filterEngine;
        this.revealTracker = revealTracker;
        this.sectionTracker = sectionTracker;
        this.overlayController = overlayController;
        this.timerService = timerService;
        this.scrollAction = scrollAction;
        this.clipboardAction = clipboardAction;
        this.externalLinkAction = externalLinkAction;
        this.eventBus = eventBus;
        this.config = config;
        this.visibleEntries = filterEngine.apply(catalog, filterState);
    }

    /**
     * First render: starts landmark tracking and registers every revealable
     * element without delay. Later calls are ignored.
     *
     * @throws IllegalStateException if the model was already closed
     */
    public synchronized void mount() {
        if (closed) {
            throw new IllegalStateException("Browser model is closed");
        }
        if (mounted) {
            return;
        }
        mounted = true;
        LOG.info("Mounting browser: {} entries, {} landmarks", catalog.size(), sectionTracker.landmarks().size());
        sectionTracker.start();
        revealTracker.register(renderedRevealIds());
    }

    // -- Filtering --

    public synchronized void setQuery(String query) {
        applyFilter(filterState.withQuery(query));
    }

    /** Selects a tag; tags outside the {@link TagIndex} fall back to {@link TagIndex#ALL}. */
    public synchronized void setActiveTag(String tag) {
        applyFilter(filterState.withTag(tag));
    }

    public synchronized void applyFilter(String query, String tag) {
        applyFilter(new FilterState(query, tag));
    }

    private void applyFilter(FilterState next) {
        if (!catalog.tagIndex().contains(next.activeTag())) {
            LOG.warn("Unknown tag '{}', falling back to '{}'", next.activeTag(), TagIndex.ALL);
            next = next.withTag(TagIndex.ALL);
        }
        if (next.equals(filterState)) {
            return;
        }
        filterState = next;

        List<Entry> result = filterEngine.apply(catalog, next);
        boolean changed = !result.equals(visibleEntries);
        visibleEntries = result;
        LOG.debug("Filter {} -> {} of {} entries", next, result.size(), catalog.size());
        eventBus.post(new FilterAppliedEvent(next, result));

        if (changed && mounted) {
            scheduleRevealRegistration();
        }
    }

    private void scheduleRevealRegistration() {
        if (pendingRegistration != null) {
            pendingRegistration.cancel();
        }
        long round = ++registrationRound;
        pendingRegistration = timerService.schedule(config.getRevealSettleDelayMs(),
                () -> runRevealRegistration(round));
    }

    private synchronized void runRevealRegistration(long round) {
        if (round != registrationRound || !mounted) {
            LOG.trace("Skipping superseded reveal registration (round {})", round);
            return;
        }
        pendingRegistration = null;
        revealTracker.register(renderedRevealIds());
    }

    /**
     * Ids of every revealable element in the current render: static page
     * elements, credential cards and the visible entry cards.
     */
    public synchronized List<String> renderedRevealIds() {
        List<String> ids = new ArrayList<>(config.getRevealElements());
        for (Entry entry : visibleEntries) {
            ids.add(entry.elementId());
        }
        for (Entry credential : catalog.credentials()) {
            ids.add(credential.elementId());
        }
        return ids;
    }

    // -- User actions --

    /**
     * Acts on a card link: detail links open the overlay, external links are
     * handed to the host. Only cards of the current filter result can be
     * activated.
     *
     * @throws IllegalArgumentException if the entry is filtered out or the
     *                                  link does not belong to it
     */
    public synchronized void activateLink(Entry entry, EntryLink link) {
        if (!visibleEntries.contains(entry)) {
            throw new IllegalArgumentException("'" + entry.title() + "' is not in the current filter result");
        }
        if (!entry.links().contains(link)) {
            throw new IllegalArgumentException("Link '" + link.label() + "' does not belong to '" + entry.title() + "'");
        }
        if (link.isExternal()) {
            externalLinkAction.open(link.target());
        } else {
            overlayController.open(entry);
        }
    }

    /** Scrolls to a configured landmark; unknown ids are skipped. */
    public synchronized void navigateTo(String landmark) {
        if (!sectionTracker.isKnownLandmark(landmark)) {
            LOG.debug("Ignoring navigation to unknown landmark '{}'", landmark);
            return;
        }
        scrollAction.scrollTo(landmark);
    }

    /** Copies the contact address. Failures are not surfaced to the user. */
    public void copyContactEmail() {
        String email = config.getContactEmail();
        if (email == null || email.isBlank()) {
            return;
        }
        try {
            clipboardAction.write(email);
        } catch (Exception e) {
            LOG.debug("Clipboard write failed", e);
        }
    }

    public DetailOverlayController overlayController() {
        return overlayController;
    }

    // -- Read side --

    public synchronized List<Entry> visibleEntries() {
        return visibleEntries;
    }

    public List<Entry> credentials() {
        return catalog.credentials();
    }

    public List<String> tags() {
        return catalog.tagIndex().tags();
    }

    public synchronized FilterState filterState() {
        return filterState;
    }

    public String activeLandmark() {
        return sectionTracker.activeLandmark();
    }

    public Optional<DetailOverlay> overlay() {
        return overlayController.overlay();
    }

    public boolean isRevealed(String elementId) {
        return revealTracker.isRevealed(elementId);
    }

    public synchronized boolean hasPendingRegistration() {
        return pendingRegistration != null;
    }

    /**
     * Releases both tracker subscriptions, drops any pending registration and
     * shuts the timer service down. The model cannot be mounted again.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        mounted = false;
        registrationRound++;
        if (pendingRegistration != null) {
            pendingRegistration.cancel();
            pendingRegistration = null;
        }
        revealTracker.close();
        sectionTracker.close();
        timerService.close();
        LOG.info("Browser closed");
    }
}
