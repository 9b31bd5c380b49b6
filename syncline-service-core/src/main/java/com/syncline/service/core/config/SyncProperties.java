package com.syncline.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "syncline.sync")
public class SyncProperties {
    /** Rows read per emitter page. */
    private int pageSize = 1000;
    /** Upper bound on acks accepted in one request. */
    private int maxAcks = 1000;
    /** Tombstones older than this are purged; cursors older than this must reset. */
    private Duration tombstoneRetention = Duration.ofDays(100);

    private Retention retention = new Retention();
    private Legacy legacy = new Legacy();

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxAcks() {
        return maxAcks;
    }

    public void setMaxAcks(int maxAcks) {
        this.maxAcks = maxAcks;
    }

    public Duration getTombstoneRetention() {
        return tombstoneRetention;
    }

    public void setTombstoneRetention(Duration tombstoneRetention) {
        this.tombstoneRetention = tombstoneRetention;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Legacy getLegacy() {
        return legacy;
    }

    public void setLegacy(Legacy legacy) {
        this.legacy = legacy;
    }

    public static class Retention {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }

    public static class Legacy {
        private Duration deltaMaxAge = Duration.ofDays(100);
        private int deltaLimit = 10_000;

        public Duration getDeltaMaxAge() {
            return deltaMaxAge;
        }

        public void setDeltaMaxAge(Duration deltaMaxAge) {
            this.deltaMaxAge = deltaMaxAge;
        }

        public int getDeltaLimit() {
            return deltaLimit;
        }

        public void setDeltaLimit(int deltaLimit) {
            this.deltaLimit = deltaLimit;
        }
    }
}
