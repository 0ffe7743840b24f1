package com.openguide.notification.api.controller;

import com.openguide.common.dto.BaseResponse;
import com.openguide.common.util.Constants;
import com.openguide.notification.domain.model.Notification;
import com.openguide.notification.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping("/me")
    public ResponseEntity<BaseResponse<List<Notification>>> getMyNotifications(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestParam(defaultValue = "20") int limit) {
        int capped = Math.max(1, Math.min(limit, Constants.MAX_PAGE_SIZE));
        return ResponseEntity.ok(BaseResponse.success(notificationService.findForUser(userId, capped)));
    }
}
