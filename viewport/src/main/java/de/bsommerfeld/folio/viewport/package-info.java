/**
 * Visibility-driven state for the browser: one-shot reveal animation and
 * active-landmark tracking.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   Rendering host
 *        │  batched VisibilitySignal lists (UI loop, in order, never re-entrant)
 *        ▼
 *   VisibilityHost      ← interface, implemented by the host
 *    ┌───┴─────────────────────┐
 *    │                         │
 *  RevealTracker          SectionActivityTracker
 *  (rendered set,         (fixed landmarks,
 *   PENDING → REVEALED)    max ratio wins, sticky)
 * </pre>
 *
 * <h2>Ownership</h2>
 * Each tracker owns at most one {@link de.bsommerfeld.folio.viewport.VisibilitySubscription}.
 * Re-registering or closing a tracker closes its subscription before
 * anything else happens, and batches from a closed subscription are dropped.
 *
 * <h2>Degraded mode</h2>
 * When {@link de.bsommerfeld.folio.viewport.VisibilityHost#supportsVisibilitySignals()}
 * is {@code false}, revealables are revealed during registration and the
 * active landmark stays at the first configured landmark.
 */
package de.bsommerfeld.folio.viewport;
