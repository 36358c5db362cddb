package de.bsommerfeld.folio.browser.host;

/**
 * Writes text to the system clipboard. Callers treat it as fire-and-forget.
 */
@FunctionalInterface
public interface ClipboardAction {

    /**
     * @throws Exception if the host refuses or cannot access the clipboard
     */
    void write(String text) throws Exception;
}
