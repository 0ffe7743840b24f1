package com.openguide.notification.domain.repository;

import com.openguide.notification.domain.model.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface NotificationRepository extends MongoRepository<Notification, String> {
    boolean existsByEventId(String eventId);
    List<Notification> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);
    List<Notification> findByTripIdOrderByCreatedAtAsc(String tripId);
}
