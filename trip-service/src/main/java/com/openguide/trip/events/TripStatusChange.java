package com.openguide.trip.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripStatusChange {
    private UUID tripId;
    private String status;
    private Map<String, Object> extraFields;
}
