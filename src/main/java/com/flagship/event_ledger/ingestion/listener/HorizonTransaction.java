package com.flagship.event_ledger.ingestion.listener;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The fields of a Horizon transaction record the listener uses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HorizonTransaction {

    private String id;

    @JsonProperty("paging_token")
    private String pagingToken;

    private boolean successful;

    private String hash;

    /** Ledger sequence the transaction was included in. */
    private long ledger;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("source_account")
    private String sourceAccount;

    @JsonProperty("memo_type")
    private String memoType;

    private String memo;

    @JsonProperty("operation_count")
    private int operationCount;
}
