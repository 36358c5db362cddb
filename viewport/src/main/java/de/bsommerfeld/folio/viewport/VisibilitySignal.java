package de.bsommerfeld.folio.viewport;

/**
 * One element's visibility as reported by the host in a signal batch.
 *
 * @param elementId    stable identity of the observed element
 * @param intersecting whether the element crosses at least one subscribed
 *                     threshold
 * @param ratio        visible fraction of the element, 0.0 to 1.0
 */
public record VisibilitySignal(String elementId, boolean intersecting, double ratio) {

    public static VisibilitySignal visible(String elementId, double ratio) {
        return new VisibilitySignal(elementId, true, ratio);
    }

    public static VisibilitySignal hidden(String elementId) {
        return new VisibilitySignal(elementId, false, 0.0);
    }
}
