package de.bsommerfeld.folio.core.catalog;

/**
 * Thrown when the embedded catalog cannot be read or is inconsistent.
 * Raised only during startup; a constructed {@link CatalogStore} never fails.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
