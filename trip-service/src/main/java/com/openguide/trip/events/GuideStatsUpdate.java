package com.openguide.trip.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Counter or rating change forwarded to the guide directory. {@code rating} is null for trip-count increments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuideStatsUpdate {
    private Long guideId;
    private UUID tripId;
    private Integer rating;
}
