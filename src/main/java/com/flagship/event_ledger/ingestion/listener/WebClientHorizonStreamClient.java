package com.flagship.event_ledger.ingestion.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

/**
 * Horizon Server-Sent Events client using WebClient.
 */
@Slf4j
public class WebClientHorizonStreamClient implements HorizonStreamClient {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() { };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientHorizonStreamClient(WebClient.Builder builder, String horizonUrl, ObjectMapper objectMapper) {
        this.webClient = builder.baseUrl(horizonUrl).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Flux<HorizonTransaction> streamTransactions(String cursor) {
        return webClient.get()
                .uri(uri -> uri.path("/transactions").queryParam("cursor", cursor).build())
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .filter(event -> event.data() != null && event.data().startsWith("{"))
                .map(event -> parse(event.data()))
                .onErrorMap(WebClientResponseException.class,
                        e -> new HorizonStreamException("Horizon responded " + e.getStatusCode(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new HorizonStreamException("Horizon unreachable: " + e.getMessage(), e));
    }

    private HorizonTransaction parse(String json) {
        try {
            return objectMapper.readValue(json, HorizonTransaction.class);
        } catch (JsonProcessingException e) {
            throw new HorizonStreamException("Unreadable transaction on stream: " + e.getOriginalMessage(), e);
        }
    }
}
