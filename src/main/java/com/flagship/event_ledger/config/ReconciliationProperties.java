package com.flagship.event_ledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "reconciliation")
@NoArgsConstructor
@Getter
@Setter
public class ReconciliationProperties {

    /** Full check cadence. Default: top of every hour. */
    private String fullCron = "0 0 * * * *";

    /** Quick (negative balance only) cadence. Default: every 15 minutes. */
    private String quickCron = "0 */15 * * * *";

    /** Settlements still non-terminal after this long are reported as stuck. */
    private Duration stuckSettlementThreshold = Duration.ofHours(1);

    private Scheduler scheduler = new Scheduler();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Scheduler {

        /** Initial value of the runtime enable toggle. */
        private boolean enabled = true;

        /** Whether triggers are registered when the application starts. */
        private boolean autoStartup = true;
    }
}
