package com.openguide.trip.client.dto;

import com.openguide.trip.domain.model.GeoPoint;

import java.math.BigDecimal;
import java.util.List;

public record GuideView(
        Long id,
        Long userId,
        String name,
        boolean active,
        BigDecimal pricePerHour,
        List<String> languages,
        Double rating,
        Double latitude,
        Double longitude,
        Integer totalTrips
) {
    public GeoPoint location() {
        return GeoPoint.of(latitude, longitude);
    }

    public double ratingOrZero() {
        return rating != null ? rating : 0.0;
    }
}
