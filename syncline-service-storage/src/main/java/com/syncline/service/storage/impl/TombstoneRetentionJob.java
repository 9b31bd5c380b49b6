package com.syncline.service.storage.impl;

import com.syncline.service.core.config.SyncProperties;
import com.syncline.service.core.tombstone.TombstoneLog;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/** Purges tombstones that fell out of the retention window. Sessions older than that are forced to reset. */
@Service
@ConditionalOnProperty(prefix = "syncline.sync.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TombstoneRetentionJob {

    private static final Logger log = LoggerFactory.getLogger(TombstoneRetentionJob.class);

    private final TombstoneLog tombstones;
    private final SyncProperties properties;
    private final Clock clock;

    public TombstoneRetentionJob(TombstoneLog tombstones, SyncProperties properties, Clock clock) {
        this.tombstones = tombstones;
        this.properties = properties;
        this.clock = clock;
    }

    /** Runs daily at 02:00 UTC unless overridden. */
    @Scheduled(cron = "${syncline.sync.retention.cron:0 0 2 * * *}", zone = "UTC")
    public int purge() {
        Instant cutoff = clock.instant().minus(properties.getTombstoneRetention());
        int removed = tombstones.purgeDeletedBefore(cutoff);
        log.info("Purged {} tombstones deleted before {}", removed, cutoff);
        return removed;
    }
}
