package com.flagship.event_ledger.ingestion.listener;

import com.flagship.event_ledger.ingestion.RawEvent;

/**
 * Hands a raw event from the listener to the processing side. Returning normally
 * means the event is durably accepted and the stream cursor may move past it.
 */
public interface RawEventForwarder {

    void forward(RawEvent event);
}
