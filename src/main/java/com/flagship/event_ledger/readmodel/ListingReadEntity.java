package com.flagship.event_ledger.readmodel;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only JPA view of a {@code listings_read} row.
 */
@Entity
@Immutable
@Table(name = "listings_read")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ListingReadEntity {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(name = "organizer_name")
    private String organizerName;

    @Column(nullable = false)
    private String status;

    @Column(nullable = false)
    private int capacity;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "source_version", nullable = false)
    private long sourceVersion;

    @Column(name = "registered_count", nullable = false)
    private long registeredCount;

    @Column(name = "attendance_count", nullable = false)
    private long attendanceCount;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @Column(name = "refreshed_at")
    private Instant refreshedAt;
}
