package com.flagship.event_ledger.reconciliation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class SchedulerStatus {
    boolean enabled;
    @JsonProperty("isRunning")
    boolean running;
    @JsonProperty("isQuickCheckRunning")
    boolean quickCheckRunning;
}
