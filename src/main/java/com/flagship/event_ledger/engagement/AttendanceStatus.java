package com.flagship.event_ledger.engagement;

public enum AttendanceStatus {
    ATTENDED,
    NO_SHOW
}
