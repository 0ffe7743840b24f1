package com.openguide.notification.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationTemplatesTest {

    private final NotificationTemplates templates = new NotificationTemplates();

    @Test
    @DisplayName("Cancellation text carries the reason")
    void cancellationReason() {
        NotificationTemplates.Rendered rendered = templates.render("trip_cancelled", Map.of("reason", "weather"));

        assertThat(rendered.title()).isEqualTo("Trip cancelled");
        assertThat(rendered.body()).isEqualTo("The trip was cancelled (weather).");
    }

    @Test
    @DisplayName("Call end falls back to the end reason")
    void callEndReason() {
        assertThat(templates.render("call_ended", Map.of("endReason", "timeout")).body()).contains("(timeout)");
    }

    @Test
    @DisplayName("Payment text without an amount stays readable")
    void paymentWithoutAmount() {
        assertThat(templates.render("payment_required", null).body()).contains("the trip price");
    }

    @Test
    @DisplayName("Unknown types get a generic text")
    void unknownType() {
        assertThat(templates.render("something_new", Map.of()).title()).isEqualTo("Trip update");
        assertThat(templates.render(null, null).title()).isEqualTo("Trip update");
    }
}
