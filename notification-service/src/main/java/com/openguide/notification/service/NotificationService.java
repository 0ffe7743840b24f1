package com.openguide.notification.service;

import com.openguide.notification.domain.model.Notification;
import com.openguide.notification.domain.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Delivers stored notifications. Push delivery is simulated by logging; the status still moves to SENT or
 * FAILED so the history reflects what happened.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;

    @Async("notificationExecutor")
    public void deliver(Notification notification) {
        log.info("Delivering {} notification {} to user {}", notification.getEventType(), notification.getId(),
                notification.getUserId());
        try {
            log.debug("PUSH -> user {}: {} | {}", notification.getUserId(), notification.getTitle(), notification.getBody());
            notification.setStatus(Notification.NotificationStatus.SENT);
            notification.setSentAt(Instant.now());
            notificationRepository.save(notification);
            log.info("Notification {} sent", notification.getId());
        } catch (Exception e) {
            log.error("Error delivering notification {}", notification.getId(), e);
            notification.setStatus(Notification.NotificationStatus.FAILED);
            notificationRepository.save(notification);
        }
    }

    public List<Notification> findForUser(Long userId, int limit) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit));
    }
}
