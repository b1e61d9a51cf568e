package com.flagship.event_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.ingestion.listener.HorizonStreamClient;
import com.flagship.event_ledger.ingestion.listener.WebClientHorizonStreamClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the Horizon streaming client from {@link IngestionProperties}.
 */
@Configuration
public class HorizonClientConfig {

    @Bean
    public HorizonStreamClient horizonStreamClient(WebClient.Builder webClientBuilder,
                                                   IngestionProperties properties,
                                                   ObjectMapper objectMapper) {
        return new WebClientHorizonStreamClient(
                webClientBuilder, properties.getListener().getHorizonUrl(), objectMapper);
    }
}
