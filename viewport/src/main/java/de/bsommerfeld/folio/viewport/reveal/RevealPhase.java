package de.bsommerfeld.folio.viewport.reveal;

/**
 * Presentation phase of a revealable element. The only transition is
 * {@code PENDING -> REVEALED}.
 */
public enum RevealPhase {
    PENDING,
    REVEALED
}
