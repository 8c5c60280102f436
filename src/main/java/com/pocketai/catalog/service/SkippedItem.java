package com.pocketai.catalog.service;

/**
 * A hub model a run could not apply, with why.
 */
public final class SkippedItem {

    public enum Cause {
        /** the descriptor could not be mapped to a valid record */
        MAPPING,
        /** a uniqueness or integrity constraint rejected the write */
        CONFLICT,
        /** any other store or runtime failure */
        STORE
    }

    private final String externalId;
    private final Cause cause;
    private final String reason;

    public SkippedItem(String externalId, Cause cause, String reason) {
        this.externalId = externalId;
        this.cause = cause;
        this.reason = reason;
    }

    public String getExternalId() {
        return externalId;
    }

    public Cause getCause() {
        return cause;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return externalId + " [" + cause + "]: " + reason;
    }
}
