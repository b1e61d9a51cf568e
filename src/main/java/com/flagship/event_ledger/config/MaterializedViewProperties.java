package com.flagship.event_ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "materialized-view")
@NoArgsConstructor
@Getter
@Setter
public class MaterializedViewProperties {

    /** Interval between full refreshes. */
    private Duration refreshInterval = Duration.ofMinutes(10);

    /** Run targeted refreshes on the view-refresh executor instead of the caller thread. */
    private boolean asyncRefresh = true;

    private int refreshPoolSize = 4;

    private Scheduler scheduler = new Scheduler();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Scheduler {

        private boolean autoStartup = true;
    }
}
