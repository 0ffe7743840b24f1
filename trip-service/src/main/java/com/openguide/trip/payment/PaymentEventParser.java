package com.openguide.trip.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openguide.trip.orchestration.TripCheckoutService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads {@code {id, type, data: {object: {id, payment_intent, metadata: {tripId}}}}}.
 */
@Component
@RequiredArgsConstructor
public class PaymentEventParser {

    private final ObjectMapper objectMapper;

    public PaymentEvent parse(String payload) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(payload);
        JsonNode object = root.path("data").path("object");
        return new PaymentEvent(
                text(root, "id"),
                text(root, "type"),
                text(object, "id"),
                text(object, "payment_intent"),
                text(object.path("metadata"), TripCheckoutService.METADATA_TRIP_ID));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
