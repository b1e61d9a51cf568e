package com.flagship.event_ledger.ingestion.listener;

/**
 * Transport or protocol failure on the Horizon stream. Always retried by the listener.
 */
public class HorizonStreamException extends RuntimeException {

    public HorizonStreamException(String message) {
        super(message);
    }

    public HorizonStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
