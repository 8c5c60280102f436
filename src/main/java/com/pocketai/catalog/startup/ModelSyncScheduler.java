package com.pocketai.catalog.startup;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pocketai.catalog.config.SyncSettings;
import com.pocketai.catalog.dto.SyncResponse;
import com.pocketai.catalog.service.ModelSyncService;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Runs the model hub sync once a day at the configured UTC hour. Holds no
 * state besides its schedule; started and stopped explicitly by
 * {@link SyncLifecycleListener}.
 */
@ApplicationScoped
public class ModelSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(ModelSyncScheduler.class);
    private static final Duration PERIOD = Duration.ofDays(1);
    private static final long STOP_GRACE_SECONDS = 30L;

    private ModelSyncService syncService;
    private SyncSettings settings;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> scheduledFuture;

    protected ModelSyncScheduler() {
    }

    @Inject
    public ModelSyncScheduler(ModelSyncService syncService, SyncSettings settings) {
        this.syncService = syncService;
        this.settings = settings;
    }

    public synchronized void start() {
        if (isRunning()) {
            log.debug("Model sync scheduler already running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "model-hub-sync");
            thread.setDaemon(true);
            return thread;
        });
        Duration initialDelay = initialDelay(ZonedDateTime.now(ZoneOffset.UTC), settings.getDailyHourUtc());
        scheduledFuture = scheduler.scheduleAtFixedRate(this::runScheduledSync,
                initialDelay.toMillis(), PERIOD.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Model sync scheduled daily at {}:00 UTC, first run in {} min",
                settings.getDailyHourUtc(), initialDelay.toMinutes());
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        if (scheduledFuture != null) {
            scheduledFuture.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        scheduledFuture = null;
        log.info("Model sync scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    void runScheduledSync() {
        try {
            SyncResponse response = SyncResponse.success(syncService.runSync());
            log.info("Scheduled model sync finished: {}", response.toMap());
        } catch (Exception e) {
            log.error("Scheduled model sync failed: {}", SyncResponse.failure(e).getMessage(), e);
        }
    }

    /**
     * Time from {@code now} until the next {@code hourUtc}:00. A run due
     * exactly now is scheduled immediately.
     */
    static Duration initialDelay(ZonedDateTime now, int hourUtc) {
        ZonedDateTime utcNow = now.withZoneSameInstant(ZoneOffset.UTC);
        ZonedDateTime next = utcNow.withHour(hourUtc).withMinute(0).withSecond(0).withNano(0);
        if (next.isBefore(utcNow)) {
            next = next.plusDays(1);
        }
        return Duration.between(utcNow, next);
    }
}
