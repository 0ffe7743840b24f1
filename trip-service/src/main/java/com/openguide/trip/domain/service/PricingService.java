package com.openguide.trip.domain.service;

import com.openguide.common.exception.ResourceNotFoundException;
import com.openguide.common.exception.ValidationException;
import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.client.dto.PlaceView;
import com.openguide.trip.domain.model.GeoPoint;
import com.openguide.trip.domain.model.ItineraryStop;
import com.openguide.trip.domain.model.PriceBreakdown;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Duration estimates and price breakdowns for itineraries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingService {

    private static final double EARTH_RADIUS_KM = 6371.0;
    private static final double MIN_LEG_BUFFER_MINUTES = 5.0;
    private static final double LEG_BUFFER_RATIO = 0.1;
    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final DirectoryGateway directoryGateway;

    @Value("${trip.pricing.average-speed-kmh:30}")
    private double averageSpeedKmh;

    @Value("${trip.pricing.safety-buffer-minutes:15}")
    private double safetyBufferMinutes;

    @Value("${trip.pricing.service-fee-percent:0}")
    private BigDecimal serviceFeePercent;

    /**
     * Visit time plus travel between consecutive stops (haversine distance at average speed, each leg padded by
     * max(5 min, 10%)) plus one safety buffer, rounded up to whole minutes.
     */
    public TripEstimate estimate(List<ItineraryStop> itinerary, Instant startAt) {
        if (itinerary == null || itinerary.isEmpty()) {
            throw new ValidationException("Itinerary must contain at least one place");
        }
        if (startAt == null) {
            throw new ValidationException("Start time is required");
        }
        List<PlaceView> places = new ArrayList<>();
        for (ItineraryStop stop : itinerary) {
            places.add(loadPlace(stop.getPlaceId()));
        }

        int totalVisitMinutes = itinerary.stream()
                .mapToInt(stop -> stop.getVisitDurationMinutes() != null ? stop.getVisitDurationMinutes() : 0)
                .sum();

        double travelMinutes = 0;
        for (int i = 0; i < places.size() - 1; i++) {
            GeoPoint from = places.get(i).location();
            GeoPoint to = places.get(i + 1).location();
            if (from == null || to == null) {
                throw new ValidationException("Missing coordinates for place " + places.get(from == null ? i : i + 1).id());
            }
            double legMinutes = haversineKm(from, to) / averageSpeedKmh * 60;
            travelMinutes += legMinutes + Math.max(MIN_LEG_BUFFER_MINUTES, legMinutes * LEG_BUFFER_RATIO);
        }

        int totalMinutes = (int) Math.ceil(totalVisitMinutes + travelMinutes + safetyBufferMinutes);
        return new TripEstimate(totalVisitMinutes, (int) Math.ceil(travelMinutes), totalMinutes,
                startAt.plusSeconds(totalMinutes * 60L));
    }

    /**
     * guideFee = rate x minutes / 60; tickets = sum of ticket prices of stops that need one;
     * serviceFee = (guideFee + tickets) x percent / 100. Each part rounded half-up to cents.
     */
    public PriceBreakdown priceBreakdown(BigDecimal pricePerHour, int totalMinutes, List<ItineraryStop> itinerary) {
        BigDecimal rate = pricePerHour != null ? pricePerHour : BigDecimal.ZERO;
        BigDecimal guideFee = rate.multiply(BigDecimal.valueOf(totalMinutes))
                .divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);

        BigDecimal tickets = BigDecimal.ZERO;
        for (ItineraryStop stop : itinerary) {
            if (!stop.isTicketRequired()) continue;
            PlaceView place = loadPlace(stop.getPlaceId());
            if (place.ticketPrice() != null) {
                tickets = tickets.add(place.ticketPrice());
            }
        }
        tickets = tickets.setScale(2, RoundingMode.HALF_UP);

        BigDecimal serviceFee = guideFee.add(tickets)
                .multiply(serviceFeePercent)
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        BigDecimal total = guideFee.add(tickets).add(serviceFee).setScale(2, RoundingMode.HALF_UP);

        return PriceBreakdown.builder()
                .guideFee(guideFee)
                .tickets(tickets)
                .serviceFee(serviceFee)
                .total(total)
                .build();
    }

    static double haversineKm(GeoPoint a, GeoPoint b) {
        double dLat = Math.toRadians(b.getLatitude() - a.getLatitude());
        double dLng = Math.toRadians(b.getLongitude() - a.getLongitude());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.getLatitude())) * Math.cos(Math.toRadians(b.getLatitude()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    private PlaceView loadPlace(Long placeId) {
        return directoryGateway.findPlace(placeId)
                .orElseThrow(() -> new ResourceNotFoundException("Place", placeId));
    }
}
