package de.bsommerfeld.folio.viewport.section;

import com.google.inject.Singleton;
import de.bsommerfeld.folio.core.config.BrowserConfig;
import de.bsommerfeld.folio.core.event.ApplicationEventBus;
import de.bsommerfeld.folio.core.event.BrowserEvents.ActiveLandmarkChangedEvent;
import de.bsommerfeld.folio.viewport.VisibilityHost;
import de.bsommerfeld.folio.viewport.VisibilitySignal;
import de.bsommerfeld.folio.viewport.VisibilitySubscription;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tracks which navigation landmark is currently in view.
 *
 * <p>
 * Each batch picks the intersecting landmark with the greatest ratio; on a
 * tie the one delivered last wins. A batch without any intersecting landmark
 * leaves the active one unchanged, so the value never goes back to "none".
 * Before the first batch, and forever on hosts without visibility signals,
 * the active landmark is the first configured one.
 */
@Singleton
public class SectionActivityTracker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SectionActivityTracker.class);

    static final String FALLBACK_LANDMARK = "home";

    private final VisibilityHost host;
    private final ApplicationEventBus eventBus;
    private final List<String> landmarks;
    private final List<Double> thresholds;

    private String active;
    private VisibilitySubscription subscription;
    private long generation;

    @Inject
    public SectionActivityTracker(VisibilityHost host, ApplicationEventBus eventBus, BrowserConfig config) {
        this(host, eventBus, config.getLandmarks(), config.getLandmarkThresholds());
    }

    public SectionActivityTracker(VisibilityHost host, ApplicationEventBus eventBus,
            List<String> landmarks, List<Double> thresholds) {
        this.host = host;
        this.eventBus = eventBus;
        this.landmarks = List.copyOf(landmarks);
        this.thresholds = List.copyOf(thresholds);
        this.active = this.landmarks.isEmpty() ? FALLBACK_LANDMARK : this.landmarks.get(0);
    }

    /**
     * Subscribes to the landmarks that currently resolve. Calling it again
     * replaces the previous subscription.
     */
    public void start() {
        releaseSubscription();

        if (!host.supportsVisibilitySignals()) {
            LOG.info("No visibility signals available, active landmark stays '{}'", active);
            return;
        }

        List<String> resolved = landmarks.stream().filter(host::resolves).toList();
        if (resolved.size() < landmarks.size()) {
            LOG.debug("Skipping unresolved landmarks: {}",
                    landmarks.stream().filter(id -> !resolved.contains(id)).toList());
        }
        if (resolved.isEmpty()) {
            return;
        }

        long owner = ++generation;
        subscription = host.subscribe(resolved, thresholds, batch -> {
            if (owner == generation) {
                onSignals(batch);
            }
        });
        LOG.debug("Observing landmarks {} at thresholds {}", resolved, thresholds);
    }

    /** Applies one signal batch. */
    public void onSignals(List<VisibilitySignal> batch) {
        VisibilitySignal best = null;
        for (VisibilitySignal signal : batch) {
            if (!signal.intersecting() || !landmarks.contains(signal.elementId())) {
                continue;
            }
            if (best == null || signal.ratio() >= best.ratio()) {
                best = signal;
            }
        }
        if (best != null) {
            setActiveLandmark(best.elementId());
        }
    }

    /**
     * Sets the active landmark. Ids outside the configured list are ignored.
     *
     * @return {@code true} if the active landmark changed
     */
    public boolean setActiveLandmark(String landmark) {
        if (!landmarks.contains(landmark)) {
            LOG.debug("Ignoring unknown landmark: {}", landmark);
            return false;
        }
        if (landmark.equals(active)) {
            return false;
        }
        String previous = active;
        active = landmark;
        LOG.debug("Active landmark {} -> {}", previous, landmark);
        eventBus.post(new ActiveLandmarkChangedEvent(previous, landmark));
        return true;
    }

    public String activeLandmark() {
        return active;
    }

    public List<String> landmarks() {
        return landmarks;
    }

    public boolean isKnownLandmark(String landmark) {
        return landmarks.contains(landmark);
    }

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
