package com.flagship.event_ledger.readmodel;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A read-model row plus the rates derived from it.
 * Rates are percentages with two decimals, null when undefined.
 */
@Value
@Builder
public class ListingStatistics {
    UUID id;
    String title;
    String organizerName;
    String status;
    int capacity;
    Instant startDate;
    Instant endDate;
    long registeredCount;
    long attendanceCount;
    Instant lastActivityAt;
    BigDecimal registrationRate;
    BigDecimal attendanceRate;
    long sourceVersion;
    Instant refreshedAt;
}
