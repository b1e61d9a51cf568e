package com.flagship.event_ledger.common;

/**
 * The storage layer failed underneath a unit of work. The work has been rolled back.
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
