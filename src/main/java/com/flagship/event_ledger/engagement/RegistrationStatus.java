package com.flagship.event_ledger.engagement;

public enum RegistrationStatus {
    CONFIRMED,
    CANCELLED
}
