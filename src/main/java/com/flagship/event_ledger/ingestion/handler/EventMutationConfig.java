package com.flagship.event_ledger.ingestion.handler;

import com.flagship.event_ledger.ingestion.EventMutationHandler;
import com.flagship.event_ledger.ingestion.EventMutationRegistry;
import com.flagship.event_ledger.ingestion.EventTypes;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The complete event type -> mutation table. Types not listed here are
 * acknowledged and skipped by the processor.
 */
@Configuration
public class EventMutationConfig {

    @Bean
    public EventMutationRegistry eventMutationRegistry(ListingEventHandlers listings,
                                                       EngagementEventHandlers engagement,
                                                       WageringEventHandlers wagering) {
        Map<String, EventMutationHandler> handlers = new LinkedHashMap<>();
        handlers.put(EventTypes.LISTING_CREATED, listings::onCreated);
        handlers.put(EventTypes.LISTING_UPDATED, listings::onUpdated);
        handlers.put(EventTypes.LISTING_DELETED, listings::onDeleted);
        handlers.put(EventTypes.LISTING_BULK_CREATED, listings::onBulkCreated);

        handlers.put(EventTypes.REGISTRATION_CONFIRMED, engagement::onRegistrationConfirmed);
        handlers.put(EventTypes.REGISTRATION_CANCELLED, engagement::onRegistrationCancelled);
        handlers.put(EventTypes.ATTENDANCE_RECORDED, engagement::onAttendanceRecorded);
        handlers.put(EventTypes.FEEDBACK_SUBMITTED, engagement::onFeedbackSubmitted);

        handlers.put(EventTypes.LEDGER_DEPOSIT, wagering::onDeposit);
        handlers.put(EventTypes.LEDGER_WITHDRAWAL, wagering::onWithdrawal);
        handlers.put(EventTypes.BET_PLACED, wagering::onBetPlaced);
        handlers.put(EventTypes.SETTLEMENT_REQUESTED, wagering::onSettlementRequested);
        handlers.put(EventTypes.SETTLEMENT_CONFIRMED, wagering::onSettlementConfirmed);
        handlers.put(EventTypes.SETTLEMENT_FAILED, wagering::onSettlementFailed);
        return new EventMutationRegistry(handlers);
    }
}
