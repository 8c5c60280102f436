package com.pocketai.catalog.startup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pocketai.catalog.config.SyncSettings;

import jakarta.inject.Inject;
import jakarta.servlet.ServletContextEvent;
import jakarta.servlet.ServletContextListener;
import jakarta.servlet.annotation.WebListener;

/**
 * Binds the daily sync schedule to the web application lifecycle.
 */
@WebListener
public class SyncLifecycleListener implements ServletContextListener {

    private static final Logger log = LoggerFactory.getLogger(SyncLifecycleListener.class);

    @Inject
    ModelSyncScheduler scheduler;

    @Inject
    SyncSettings settings;

    @Override
    public void contextInitialized(ServletContextEvent sce) {
        if (!settings.isSchedulerEnabled()) {
            log.info("Model sync scheduler disabled (HF_SYNC_ENABLED=false)");
            return;
        }
        scheduler.start();
    }

    @Override
    public void contextDestroyed(ServletContextEvent sce) {
        scheduler.stop();
    }
}
