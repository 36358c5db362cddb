package de.bsommerfeld.folio.browser.host;

/**
 * Asks the host to bring a landmark into view.
 */
@FunctionalInterface
public interface ScrollAction {

    void scrollTo(String landmarkId);
}
