package com.openguide.notification.service;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Title and body per trip event type. Unknown types get a generic text rather than being dropped.
 */
@Component
public class NotificationTemplates {

    public record Rendered(String title, String body) {
    }

    public Rendered render(String eventType, Map<String, Object> payload) {
        Map<String, Object> p = payload != null ? payload : Map.of();
        return switch (eventType == null ? "" : eventType) {
            case "guide_selected" -> new Rendered("New trip request", "A tourist picked you for a trip. Expect a call soon.");
            case "guide_deselected" -> new Rendered("Trip request withdrawn", "The tourist chose to look for another guide.");
            case "incoming_call" -> new Rendered("Incoming call", "A tourist is calling to discuss a trip.");
            case "call_ended" -> new Rendered("Call ended", "The negotiation call ended" + reason(p) + ". Review and accept or reject the trip.");
            case "payment_required" -> new Rendered("Payment required",
                    "Your guide accepted the trip. Pay " + amount(p) + " to confirm it.");
            case "trip_rejected" -> new Rendered("Trip rejected", "Your guide declined the trip" + reason(p) + ". You can pick another guide.");
            case "trip_cancelled" -> new Rendered("Trip cancelled", "The trip was cancelled" + reason(p) + ".");
            case "payment_confirmed" -> new Rendered("Payment received", "Your payment went through and the trip is confirmed.");
            case "trip_confirmed" -> new Rendered("Trip confirmed", "The tourist paid; the trip is confirmed.");
            case "trip_started" -> new Rendered("Trip started", "Your guide has started the trip. Enjoy!");
            case "trip_completed" -> new Rendered("Trip completed", "Your trip is complete. Leave a review for your guide.");
            case "proposal_received" -> new Rendered("Change proposed", "Your guide proposed a change to your trip.");
            case "proposal_accepted" -> new Rendered("Change accepted", "The tourist accepted your proposed change.");
            case "proposal_rejected" -> new Rendered("Change declined", "The tourist declined your proposed change.");
            default -> new Rendered("Trip update", "There is an update on your trip.");
        };
    }

    private static String reason(Map<String, Object> payload) {
        Object reason = payload.get("reason");
        if (reason == null) {
            reason = payload.get("endReason");
        }
        return reason == null ? "" : " (" + reason + ")";
    }

    private static String amount(Map<String, Object> payload) {
        Object amount = payload.get("amount");
        Object currency = payload.get("currency");
        if (amount == null) {
            return "the trip price";
        }
        return currency == null ? amount.toString() : amount + " " + currency.toString().toUpperCase();
    }
}
