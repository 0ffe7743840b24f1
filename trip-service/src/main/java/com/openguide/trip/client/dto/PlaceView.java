package com.openguide.trip.client.dto;

import com.openguide.trip.domain.model.GeoPoint;

import java.math.BigDecimal;

public record PlaceView(
        Long id,
        String name,
        Long provinceId,
        BigDecimal ticketPrice,
        Double latitude,
        Double longitude
) {
    public GeoPoint location() {
        return GeoPoint.of(latitude, longitude);
    }
}
