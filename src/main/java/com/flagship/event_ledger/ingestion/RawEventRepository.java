package com.flagship.event_ledger.ingestion;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RawEventRepository extends JpaRepository<RawEventEntity, Long> {

    Optional<RawEventEntity> findByEventId(String eventId);

    /**
     * Loads the row with a write lock so concurrent workers delivering the same
     * event apply it one after another; the second sees processed = true.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM RawEventEntity e WHERE e.eventId = :eventId")
    Optional<RawEventEntity> findByEventIdForUpdate(@Param("eventId") String eventId);

    /**
     * Unprocessed events still under the attempt limit, in chain order.
     */
    @Query("""
        SELECT e.eventId FROM RawEventEntity e
        WHERE e.processed = false AND e.attempts < :maxAttempts
        ORDER BY e.blockNumber ASC, e.id ASC
        """)
    List<String> findPendingEventIds(@Param("maxAttempts") int maxAttempts, Pageable page);

    long countByProcessedFalse();

    long countByProcessedFalseAndAttemptsGreaterThanEqual(int attempts);

    @Query("SELECT MIN(e.receivedAt) FROM RawEventEntity e WHERE e.processed = false")
    Optional<Instant> findOldestUnprocessedReceivedAt();
}
