package com.syncline.service.core.config;

import com.syncline.service.core.model.VersionClock;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wall clock for retention checks and the token clock stamped on every sync row, both in UTC. */
@Configuration
public class ClockConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock syncClock() {
        return Clock.systemUTC();
    }

    /** Single instance per process: tokens are only monotonic within one clock. */
    @Bean
    @ConditionalOnMissingBean
    public VersionClock versionClock(Clock syncClock) {
        return new VersionClock(syncClock);
    }
}
