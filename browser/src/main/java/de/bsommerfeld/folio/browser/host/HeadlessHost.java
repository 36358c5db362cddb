package de.bsommerfeld.folio.browser.host;

import com.google.inject.Singleton;
import de.bsommerfeld.folio.viewport.VisibilityHost;
import de.bsommerfeld.folio.viewport.VisibilityListener;
import de.bsommerfeld.folio.viewport.VisibilitySubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Host for running the core without a rendering surface. Every id resolves,
 * no visibility signals exist, and host actions are only logged. The last
 * clipboard write and scroll target are kept for inspection.
 */
@Singleton
public class HeadlessHost implements VisibilityHost, ScrollAction, ClipboardAction, ExternalLinkAction {

    private static final Logger LOG = LoggerFactory.getLogger(HeadlessHost.class);

    private String clipboard;
    private String lastScrollTarget;

    @Override
    public boolean supportsVisibilitySignals() {
        return false;
    }

    @Override
    public boolean resolves(String elementId) {
        return elementId != null && !elementId.isBlank();
    }

    @Override
    public VisibilitySubscription subscribe(Collection<String> elementIds, List<Double> thresholds,
            VisibilityListener listener) {
        LOG.warn("Visibility subscription requested on headless host, no signals will arrive");
        return new VisibilitySubscription() {
            @Override
            public void unobserve(String elementId) {
            }

            @Override
            public boolean isActive() {
                return false;
            }

            @Override
            public void close() {
            }
        };
    }

    @Override
    public void scrollTo(String landmarkId) {
        LOG.info("Scroll to '{}'", landmarkId);
        lastScrollTarget = landmarkId;
    }

    @Override
    public void write(String text) {
        LOG.info("Clipboard <- '{}'", text);
        clipboard = text;
    }

    @Override
    public void open(String target) {
        LOG.info("Open external target {}", target);
    }

    public String getClipboard() {
        return clipboard;
    }

    public String getLastScrollTarget() {
        return lastScrollTarget;
    }
}
