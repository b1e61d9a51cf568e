package com.flagship.event_ledger.ingestion.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.event_ledger.ingestion.RawEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;

/**
 * Typed access to the JSON payload of one raw event. Missing or malformed
 * required fields fail with {@link IllegalArgumentException} naming the field.
 */
final class PayloadReader {

    private final String eventId;
    private final JsonNode root;

    private PayloadReader(String eventId, JsonNode root) {
        this.eventId = eventId;
        this.root = root;
    }

    static PayloadReader of(RawEvent event, ObjectMapper objectMapper) {
        if (event.getPayload() == null || event.getPayload().isBlank()) {
            throw new IllegalArgumentException("Event " + event.getEventId() + " has no payload");
        }
        try {
            JsonNode root = objectMapper.readTree(event.getPayload());
            if (!root.isObject()) {
                throw new IllegalArgumentException("Payload of event " + event.getEventId() + " is not a JSON object");
            }
            return new PayloadReader(event.getEventId(), root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload of event " + event.getEventId() + " is not valid JSON", e);
        }
    }

    PayloadReader child(JsonNode node) {
        return new PayloadReader(eventId, node);
    }

    JsonNode node(String field) {
        return root.get(field);
    }

    UUID uuid(String field) {
        String value = text(field);
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw invalid(field, value);
        }
    }

    String text(String field) {
        return optionalText(field).orElseThrow(() -> missing(field));
    }

    Optional<String> optionalText(String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    BigDecimal decimal(String field) {
        return optionalDecimal(field).orElseThrow(() -> missing(field));
    }

    Optional<BigDecimal> optionalDecimal(String field) {
        return optionalText(field).map(value -> {
            try {
                return new BigDecimal(value);
            } catch (NumberFormatException e) {
                throw invalid(field, value);
            }
        });
    }

    Optional<Integer> optionalInt(String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.canConvertToInt()) {
            throw invalid(field, node.asText());
        }
        return Optional.of(node.asInt());
    }

    Optional<Long> optionalLong(String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.canConvertToLong()) {
            throw invalid(field, node.asText());
        }
        return Optional.of(node.asLong());
    }

    boolean flag(String field) {
        JsonNode node = root.get(field);
        return node != null && node.asBoolean(false);
    }

    Optional<Instant> optionalInstant(String field) {
        return optionalText(field).map(value -> {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e) {
                throw invalid(field, value);
            }
        });
    }

    <E extends Enum<E>> Optional<E> optionalEnum(String field, Class<E> type) {
        return optionalText(field).map(value -> {
            try {
                return Enum.valueOf(type, value.toUpperCase());
            } catch (IllegalArgumentException e) {
                throw invalid(field, value);
            }
        });
    }

    private IllegalArgumentException missing(String field) {
        return new IllegalArgumentException("Payload of event " + eventId + " is missing " + field);
    }

    private IllegalArgumentException invalid(String field, String value) {
        return new IllegalArgumentException(
                "Payload of event " + eventId + " has invalid " + field + ": " + value);
    }
}
