package com.flagship.event_ledger.ingestion.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.engagement.AttendanceStatus;
import com.flagship.event_ledger.engagement.EngagementService;
import com.flagship.event_ledger.ingestion.RawEvent;
import org.springframework.stereotype.Component;

@Component
public class EngagementEventHandlers {

    private final EngagementService engagementService;
    private final ObjectMapper objectMapper;

    public EngagementEventHandlers(EngagementService engagementService, ObjectMapper objectMapper) {
        this.engagementService = engagementService;
        this.objectMapper = objectMapper;
    }

    public void onRegistrationConfirmed(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        engagementService.confirmRegistration(payload.uuid("listingId"), payload.text("userId"));
    }

    public void onRegistrationCancelled(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        engagementService.cancelRegistration(payload.uuid("listingId"), payload.text("userId"));
    }

    public void onAttendanceRecorded(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        engagementService.recordAttendance(payload.uuid("listingId"), payload.text("userId"),
                payload.optionalEnum("status", AttendanceStatus.class).orElse(AttendanceStatus.ATTENDED));
    }

    public void onFeedbackSubmitted(RawEvent event) {
        PayloadReader payload = PayloadReader.of(event, objectMapper);
        int rating = payload.optionalInt("rating")
                .orElseThrow(() -> new IllegalArgumentException("Payload of event " + event.getEventId() + " is missing rating"));
        engagementService.submitFeedback(payload.uuid("listingId"), payload.text("userId"), rating,
                payload.optionalText("comment").orElse(null));
    }
}
