package de.bsommerfeld.folio.viewport.reveal;

import com.google.inject.Singleton;
import de.bsommerfeld.folio.core.config.BrowserConfig;
import de.bsommerfeld.folio.core.event.ApplicationEventBus;
import de.bsommerfeld.folio.core.event.BrowserEvents.ElementRevealedEvent;
import de.bsommerfeld.folio.viewport.VisibilityHost;
import de.bsommerfeld.folio.viewport.VisibilitySignal;
import de.bsommerfeld.folio.viewport.VisibilitySubscription;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reveals each rendered element exactly once, when it first becomes
 * sufficiently visible.
 *
 * <p>
 * State is an explicit map from element id to {@link RevealPhase}. It only
 * covers the set passed to the latest {@link #register(Collection)}: ids that
 * drop out of the rendered set are forgotten, so an element that comes back
 * later starts over as {@link RevealPhase#PENDING}.
 *
 * <p>
 * Only pending elements are subscribed. A revealed element is unobserved at
 * once and never observed again. Every registration closes the previous
 * subscription first; batches still in flight from it are discarded by
 * generation check.
 *
 * <p>
 * Hosts without visibility signals get every element revealed synchronously
 * during registration.
 */
@Singleton
public class RevealTracker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RevealTracker.class);

    private final VisibilityHost host;
    private final ApplicationEventBus eventBus;
    private final double threshold;

    private final Map<String, RevealPhase> phases = new LinkedHashMap<>();
    private VisibilitySubscription subscription;
    private long generation;

    @Inject
    public RevealTracker(VisibilityHost host, ApplicationEventBus eventBus, BrowserConfig config) {
        this(host, eventBus, config.getRevealThreshold());
    }

    public RevealTracker(VisibilityHost host, ApplicationEventBus eventBus, double threshold) {
        this.host = host;
        this.eventBus = eventBus;
        this.threshold = threshold;
    }

    /**
     * Replaces the observed set with the currently rendered elements.
     *
     * @param renderedIds ids of every revealable element currently rendered;
     *                    ids the host cannot resolve are skipped
     * @return the ids newly subscribed as pending
     */
    public List<String> register(Collection<String> renderedIds) {
        releaseSubscription();

        Set<String> rendered = new LinkedHashSet<>();
        for (String id : renderedIds) {
            if (host.resolves(id)) {
                rendered.add(id);
            } else {
                LOG.trace("Skipping unresolved reveal target: {}", id);
            }
        }

        int before = phases.size();
        phases.keySet().retainAll(rendered);
        int dropped = before - phases.size();

        List<String> pending = new ArrayList<>();
        for (String id : rendered) {
            phases.putIfAbsent(id, RevealPhase.PENDING);
            if (phases.get(id) == RevealPhase.PENDING) {
                pending.add(id);
            }
        }
        LOG.debug("Reveal registration: {} rendered, {} pending, {} stale dropped",
                rendered.size(), pending.size(), dropped);

        if (!host.supportsVisibilitySignals()) {
            pending.forEach(this::markRevealed);
            return List.of();
        }
        if (pending.isEmpty()) {
            return List.of();
        }

        long owner = ++generation;
        subscription = host.subscribe(pending, List.of(threshold), batch -> {
            if (owner == generation) {
                onSignals(batch);
            } else {
                LOG.trace("Discarding batch from superseded reveal subscription");
            }
        });
        return List.copyOf(pending);
    }

    /**
     * Handles one batch in delivery order. Intersecting signals for pending
     * elements reveal them; everything else is ignored.
     */
    public void onSignals(List<VisibilitySignal> batch) {
        for (VisibilitySignal signal : batch) {
            if (signal.intersecting() && markRevealed(signal.elementId()) && subscription != null) {
                subscription.unobserve(signal.elementId());
            }
        }
        if (subscription != null && !phases.containsValue(RevealPhase.PENDING)) {
            LOG.debug("All tracked elements revealed, releasing subscription");
            releaseSubscription();
        }
    }

    /**
     * Moves a tracked element from pending to revealed.
     *
     * @return {@code true} if this call performed the transition
     */
    public boolean markRevealed(String elementId) {
        if (phases.get(elementId) != RevealPhase.PENDING) {
            return false;
        }
        phases.put(elementId, RevealPhase.REVEALED);
        LOG.debug("Revealed {}", elementId);
        eventBus.post(new ElementRevealedEvent(elementId));
        return true;
    }

    /** Phase of a tracked element, {@code null} if it is not tracked. */
    public RevealPhase phaseOf(String elementId) {
        return phases.get(elementId);
    }

    public boolean isRevealed(String elementId) {
        return phases.get(elementId) == RevealPhase.REVEALED;
    }

    /** Tracked ids in registration order. */
    public Set<String> trackedIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(phases.keySet()));
    }

    /** Whether a subscription is currently held. */
    public boolean isObserving() {
        return subscription != null;
    }

    @Override
    public void close() {
        releaseSubscription();
    }

    private void releaseSubscription() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        generation++;
    }
}
