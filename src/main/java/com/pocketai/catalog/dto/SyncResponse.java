package com.pocketai.catalog.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import com.pocketai.catalog.service.SkippedItem;
import com.pocketai.catalog.service.SyncRunSummary;

/**
 * Payload returned by both sync triggers:
 * {@code {status, created, updated, skipped, message}}.
 */
public final class SyncResponse {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILURE = "failure";

    private final String status;
    private final int created;
    private final int updated;
    private final int skipped;
    private final String message;

    private SyncResponse(String status, int created, int updated, int skipped, String message) {
        this.status = status;
        this.created = created;
        this.updated = updated;
        this.skipped = skipped;
        this.message = message;
    }

    public static SyncResponse success(SyncRunSummary summary) {
        StringBuilder message = new StringBuilder()
                .append("Synced ").append(summary.getFetched()).append(" model(s) for filter '")
                .append(summary.getFilterLabel()).append("'.");
        if (summary.getSkipped() > 0) {
            SkippedItem first = summary.getSkippedItems().get(0);
            message.append(" First skip: ").append(first);
        }
        return new SyncResponse(STATUS_SUCCESS, summary.getCreated(), summary.getUpdated(),
                summary.getSkipped(), message.toString());
    }

    public static SyncResponse failure(Throwable error) {
        String description = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new SyncResponse(STATUS_FAILURE, 0, 0, 0, description);
    }

    public String getStatus() {
        return status;
    }

    public int getCreated() {
        return created;
    }

    public int getUpdated() {
        return updated;
    }

    public int getSkipped() {
        return skipped;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status);
        out.put("created", created);
        out.put("updated", updated);
        out.put("skipped", skipped);
        out.put("message", message);
        return out;
    }
}
