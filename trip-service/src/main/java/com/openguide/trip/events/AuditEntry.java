package com.openguide.trip.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {
    private Long actorId;
    private String action;
    private String resourceType;
    private String resourceId;
    private Map<String, Object> details;
    private Instant occurredAt;
}
