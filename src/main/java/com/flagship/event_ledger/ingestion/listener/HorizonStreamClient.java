package com.flagship.event_ledger.ingestion.listener;

import reactor.core.publisher.Flux;

/**
 * Streaming access to Horizon transactions.
 */
public interface HorizonStreamClient {

    /**
     * Streams transactions after {@code cursor} ("now" for only new ones). The flux
     * completes when the server closes the stream and errors on transport failure.
     */
    Flux<HorizonTransaction> streamTransactions(String cursor);
}
