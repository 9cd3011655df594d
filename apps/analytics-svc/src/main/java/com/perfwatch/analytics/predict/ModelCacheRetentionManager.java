package com.perfwatch.analytics.predict;

import com.perfwatch.analytics.config.AnalyticsProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ModelCacheRetentionManager {

    private static final Logger log = LoggerFactory.getLogger(ModelCacheRetentionManager.class);

    private final ModelRegistry registry;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public ModelCacheRetentionManager(ModelRegistry registry, AnalyticsProperties properties, Clock analyticsClock) {
        this(registry, properties.retentionDays(), analyticsClock);
    }

    ModelCacheRetentionManager(ModelRegistry registry, int retentionDays, Clock clock) {
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
        this.registry = registry;
        this.retention = Duration.ofDays(retentionDays);
        this.clock = clock;
    }

    @Scheduled(cron = "${perfwatch.analytics.cache-cleanup-cron:0 15 3 * * *}")
    public void evictIdleModelsOnSchedule() {
        evictIdleModels("scheduled");
    }

    public int evictIdleModelsNow() {
        return evictIdleModels("inline");
    }

    private int evictIdleModels(String source) {
        Instant cutoff = currentCutoff();
        int removed = registry.evictIdleSince(cutoff);
        if (removed > 0) {
            log.info("Model cache retention ({}): {} models idle since before {} removed", source, removed, cutoff);
        } else {
            log.debug("Model cache retention ({}): no models idle since before {}", source, cutoff);
        }
        return removed;
    }

    Instant currentCutoff() {
        return clock.instant().minus(retention);
    }
}
