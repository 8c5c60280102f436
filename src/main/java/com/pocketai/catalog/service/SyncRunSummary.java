package com.pocketai.catalog.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one sync run.
 */
public final class SyncRunSummary {

    private final String filterLabel;
    private final int limit;
    private final int fetched;
    private final int created;
    private final int updated;
    private final List<SkippedItem> skippedItems;
    private final Instant startedAt;
    private final Instant finishedAt;

    private SyncRunSummary(Tally tally, Instant finishedAt) {
        this.filterLabel = tally.filterLabel;
        this.limit = tally.limit;
        this.fetched = tally.fetched;
        this.created = tally.created;
        this.updated = tally.updated;
        this.skippedItems = List.copyOf(tally.skipped);
        this.startedAt = tally.startedAt;
        this.finishedAt = finishedAt;
    }

    public String getFilterLabel() {
        return filterLabel;
    }

    public int getLimit() {
        return limit;
    }

    public int getFetched() {
        return fetched;
    }

    public int getCreated() {
        return created;
    }

    public int getUpdated() {
        return updated;
    }

    public int getSkipped() {
        return skippedItems.size();
    }

    public List<SkippedItem> getSkippedItems() {
        return skippedItems;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return String.format("created=%d, updated=%d, skipped=%d (fetched %d, filter '%s')",
                created, updated, getSkipped(), fetched, filterLabel);
    }

    /**
     * Mutable counters for a run in progress. Not thread-safe; one run owns
     * one tally.
     */
    static final class Tally {
        private final String filterLabel;
        private final int limit;
        private final Instant startedAt;
        private final List<SkippedItem> skipped = new ArrayList<>();
        private int fetched;
        private int created;
        private int updated;

        Tally(String filterLabel, int limit, Instant startedAt) {
            this.filterLabel = filterLabel;
            this.limit = limit;
            this.startedAt = startedAt;
        }

        void fetched(int count) {
            fetched = count;
        }

        void created() {
            created++;
        }

        void updated() {
            updated++;
        }

        void skipped(SkippedItem item) {
            skipped.add(item);
        }

        SyncRunSummary finish(Instant finishedAt) {
            return new SyncRunSummary(this, finishedAt);
        }
    }
}
