package com.flagship.event_ledger.engagement;

import com.flagship.event_ledger.listing.ListingNotFoundException;
import com.flagship.event_ledger.listing.ListingRepository;
import com.flagship.event_ledger.readmodel.MaterializedViewService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import static com.flagship.event_ledger.common.JdbcTimestamps.toDb;

/**
 * Registrations, attendance and feedback: the transactional rows behind the
 * read-model counters.
 *
 * One registration and one attendance row exist per (listing, user); repeated
 * events move them between states. Every change schedules a targeted refresh of
 * the listing's read row once the surrounding transaction commits.
 */
@Service
@Slf4j
public class EngagementService {

    private final JdbcTemplate jdbcTemplate;
    private final ListingRepository listingRepository;
    private final MaterializedViewService materializedViewService;
    private final Clock clock;

    public EngagementService(JdbcTemplate jdbcTemplate,
                             ListingRepository listingRepository,
                             MaterializedViewService materializedViewService,
                             Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.listingRepository = listingRepository;
        this.materializedViewService = materializedViewService;
        this.clock = clock;
    }

    /**
     * @throws ListingNotFoundException if the listing is not in the write model
     */
    @Transactional
    public void confirmRegistration(UUID listingId, String userId) {
        requireListing(listingId);
        Instant now = clock.instant();
        int updated = jdbcTemplate.update(
            "UPDATE registrations SET status = ?, updated_at = ? WHERE listing_id = ? AND user_id = ?",
            RegistrationStatus.CONFIRMED.name(), toDb(now), listingId, userId);
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO registrations (id, listing_id, user_id, status, created_at, updated_at) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                UUID.randomUUID(), listingId, userId, RegistrationStatus.CONFIRMED.name(), toDb(now), toDb(now));
        }
        log.info("Registration confirmed: listingId={}, userId={}", listingId, userId);
        materializedViewService.refreshAfterCommit(listingId);
    }

    /**
     * @throws IllegalStateException if the user never registered for the listing
     */
    @Transactional
    public void cancelRegistration(UUID listingId, String userId) {
        int updated = jdbcTemplate.update(
            "UPDATE registrations SET status = ?, updated_at = ? WHERE listing_id = ? AND user_id = ?",
            RegistrationStatus.CANCELLED.name(), toDb(clock.instant()), listingId, userId);
        if (updated == 0) {
            throw new IllegalStateException(String.format(
                "No registration of user %s for listing %s to cancel", userId, listingId));
        }
        log.info("Registration cancelled: listingId={}, userId={}", listingId, userId);
        materializedViewService.refreshAfterCommit(listingId);
    }

    @Transactional
    public void recordAttendance(UUID listingId, String userId, AttendanceStatus status) {
        requireListing(listingId);
        Instant now = clock.instant();
        int updated = jdbcTemplate.update(
            "UPDATE attendances SET status = ?, created_at = ? WHERE listing_id = ? AND user_id = ?",
            status.name(), toDb(now), listingId, userId);
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO attendances (id, listing_id, user_id, status, created_at) VALUES (?, ?, ?, ?, ?)",
                UUID.randomUUID(), listingId, userId, status.name(), toDb(now));
        }
        log.info("Attendance recorded: listingId={}, userId={}, status={}", listingId, userId, status);
        materializedViewService.refreshAfterCommit(listingId);
    }

    /**
     * @throws IllegalArgumentException if the rating is outside 1..5
     */
    @Transactional
    public void submitFeedback(UUID listingId, String userId, int rating, String remarks) {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Feedback rating must be between 1 and 5: " + rating);
        }
        requireListing(listingId);
        jdbcTemplate.update(
            "INSERT INTO event_feedback (id, listing_id, user_id, rating, remarks, created_at) VALUES (?, ?, ?, ?, ?, ?)",
            UUID.randomUUID(), listingId, userId, rating, remarks, toDb(clock.instant()));
        log.info("Feedback submitted: listingId={}, userId={}, rating={}", listingId, userId, rating);
        materializedViewService.refreshAfterCommit(listingId);
    }

    private void requireListing(UUID listingId) {
        if (listingRepository.findVersion(listingId).isEmpty()) {
            throw new ListingNotFoundException(listingId);
        }
    }
}
