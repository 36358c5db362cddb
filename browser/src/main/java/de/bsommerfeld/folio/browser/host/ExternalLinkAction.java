package de.bsommerfeld.folio.browser.host;

/**
 * Opens an external target (e.g. a repository page) outside the browser view.
 */
@FunctionalInterface
public interface ExternalLinkAction {

    void open(String target);
}
