package com.flagship.event_ledger.ingestion;

/**
 * Raw event types emitted by the platform contracts.
 */
public final class EventTypes {

    public static final String LISTING_CREATED = "listing.created";
    public static final String LISTING_UPDATED = "listing.updated";
    public static final String LISTING_DELETED = "listing.deleted";
    public static final String LISTING_BULK_CREATED = "listing.bulk_created";

    public static final String REGISTRATION_CONFIRMED = "registration.confirmed";
    public static final String REGISTRATION_CANCELLED = "registration.cancelled";
    public static final String ATTENDANCE_RECORDED = "attendance.recorded";
    public static final String FEEDBACK_SUBMITTED = "feedback.submitted";

    public static final String LEDGER_DEPOSIT = "ledger.deposit";
    public static final String LEDGER_WITHDRAWAL = "ledger.withdrawal";
    public static final String BET_PLACED = "bet.placed";
    public static final String SETTLEMENT_REQUESTED = "settlement.requested";
    public static final String SETTLEMENT_CONFIRMED = "settlement.confirmed";
    public static final String SETTLEMENT_FAILED = "settlement.failed";

    /** Plain chain transaction with no platform payload. */
    public static final String STELLAR_TRANSACTION = "stellar.transaction";

    private EventTypes() {
    }
}
