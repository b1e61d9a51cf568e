package com.flagship.event_ledger.ingestion.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.event_ledger.ingestion.EventTypes;
import com.flagship.event_ledger.ingestion.RawEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Converts Horizon transactions into raw events.
 *
 * A memo holding a JSON object {@code {"type": ..., "id": ..., "payload": {...}}} is a
 * platform event of that type; any other successful transaction becomes a
 * {@code stellar.transaction}. Failed transactions produce nothing.
 */
@Component
@Slf4j
public class HorizonEventMapper {

    private final ObjectMapper objectMapper;

    public HorizonEventMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<RawEvent> toRawEvent(HorizonTransaction tx) {
        if (!tx.isSuccessful()) {
            log.debug("Skipping failed transaction {}", tx.getHash());
            return Optional.empty();
        }

        RawEvent.RawEventBuilder event = RawEvent.builder()
                .eventId(tx.getHash())
                .contract(tx.getSourceAccount())
                .blockNumber(tx.getLedger())
                .timestamp(tx.getCreatedAt());

        Optional<JsonNode> domainEvent = memoEvent(tx);
        if (domainEvent.isPresent()) {
            JsonNode memo = domainEvent.get();
            JsonNode payload = memo.get("payload");
            if (memo.hasNonNull("id")) {
                event.eventId(memo.get("id").asText());
            }
            event.type(memo.get("type").asText())
                    .payload(payload != null ? payload.toString() : "{}");
        } else {
            event.type(EventTypes.STELLAR_TRANSACTION).payload(summary(tx));
        }
        return Optional.of(event.build());
    }

    private Optional<JsonNode> memoEvent(HorizonTransaction tx) {
        String memo = tx.getMemo();
        if (!"text".equals(tx.getMemoType()) || memo == null || !memo.trim().startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(memo);
            if (node.isObject() && node.hasNonNull("type")) {
                return Optional.of(node);
            }
        } catch (JsonProcessingException e) {
            log.debug("Memo of transaction {} is not a platform event: {}", tx.getHash(), e.getOriginalMessage());
        }
        return Optional.empty();
    }

    private String summary(HorizonTransaction tx) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("hash", tx.getHash());
        node.put("sourceAccount", tx.getSourceAccount());
        node.put("ledger", tx.getLedger());
        node.put("operationCount", tx.getOperationCount());
        if (tx.getMemo() != null) {
            node.put("memoType", tx.getMemoType());
            node.put("memo", tx.getMemo());
        }
        return node.toString();
    }
}
