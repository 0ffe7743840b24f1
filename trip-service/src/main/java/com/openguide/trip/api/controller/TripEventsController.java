package com.openguide.trip.api.controller;

import com.openguide.common.util.Constants;
import com.openguide.trip.events.TripStatusEmitter;
import com.openguide.trip.orchestration.TripQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/trips")
@RequiredArgsConstructor
public class TripEventsController {

    private final TripQueryService queryService;
    private final TripStatusEmitter statusEmitter;

    /** Server-sent {@code trip_status_updated} events for one trip, open to its tourist and guide. */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(
            @PathVariable UUID id,
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) Long userId,
            @RequestHeader(value = Constants.GUIDE_ID_HEADER, required = false) Long guideId) {
        queryService.getTrip(id, userId, guideId);
        return statusEmitter.subscribe(id);
    }
}
