package com.openguide.trip.api.controller;

import com.openguide.common.dto.BaseResponse;
import com.openguide.common.util.Constants;
import com.openguide.trip.api.dto.CallJoinResponse;
import com.openguide.trip.api.dto.EndCallRequest;
import com.openguide.trip.api.dto.TripResponse;
import com.openguide.trip.call.CallSessionService;
import com.openguide.trip.orchestration.TripOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Negotiation call endpoints. Both parties identify by user id.
 */
@RestController
@RequestMapping("/api/v1/calls")
@RequiredArgsConstructor
public class CallController {

    private final CallSessionService callSessionService;
    private final TripOrchestrator tripOrchestrator;

    @PostMapping("/{callId}/join")
    public ResponseEntity<BaseResponse<CallJoinResponse>> joinCall(
            @PathVariable UUID callId,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId) {
        CallJoinResponse response = CallJoinResponse.from(callSessionService.join(callId, userId));
        return ResponseEntity.ok(BaseResponse.success("Joined call successfully", response));
    }

    @PostMapping("/{callId}/end")
    public ResponseEntity<BaseResponse<TripResponse>> endCall(
            @PathVariable UUID callId,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody(required = false) EndCallRequest request) {
        TripResponse response = TripResponse.from(tripOrchestrator.endCall(callId, userId, request));
        return ResponseEntity.ok(BaseResponse.success("Call ended successfully", response));
    }
}
