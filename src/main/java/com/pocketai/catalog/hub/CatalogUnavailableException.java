package com.pocketai.catalog.hub;

/**
 * The hub listing could not be obtained. Aborts a sync run before any write.
 */
public class CatalogUnavailableException extends Exception {

    public enum Reason {
        UNREACHABLE,
        RATE_LIMITED,
        REJECTED
    }

    private final Reason reason;

    public CatalogUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CatalogUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
