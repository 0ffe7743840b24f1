package com.openguide.trip.domain.repository;

import com.openguide.trip.domain.model.OutboxEvent;
import com.openguide.trip.domain.model.OutboxEvent.OutboxStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, UUID> {

    /**
     * Pending events that are due, plus processing events whose claim went stale (relay crashed mid-delivery).
     */
    @Query("""
            SELECT e.id FROM OutboxEvent e
            WHERE (e.status = :pending AND e.nextAttemptAt <= :now)
               OR (e.status = :processing AND e.claimedAt < :staleBefore)
            ORDER BY e.createdAt ASC
            """)
    List<UUID> findDispatchableIds(@Param("pending") OutboxStatus pending,
                                   @Param("processing") OutboxStatus processing,
                                   @Param("now") Instant now,
                                   @Param("staleBefore") Instant staleBefore,
                                   Pageable pageable);

    /** Claims the event for one delivery attempt. 0 means another relay owns it or it is not due. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE OutboxEvent e
            SET e.status = :processing, e.claimedAt = :now, e.attempts = e.attempts + 1
            WHERE e.id = :id
              AND ((e.status = :pending AND e.nextAttemptAt <= :now)
                   OR (e.status = :processing AND e.claimedAt < :staleBefore))
            """)
    int claim(@Param("id") UUID id,
              @Param("pending") OutboxStatus pending,
              @Param("processing") OutboxStatus processing,
              @Param("now") Instant now,
              @Param("staleBefore") Instant staleBefore);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE OutboxEvent e
            SET e.status = :status, e.deliveredAt = :now, e.lastError = NULL
            WHERE e.id = :id
            """)
    int markDelivered(@Param("id") UUID id, @Param("status") OutboxStatus status, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE OutboxEvent e
            SET e.status = :status, e.nextAttemptAt = :nextAttemptAt, e.lastError = :error
            WHERE e.id = :id
            """)
    int markAttemptFailed(@Param("id") UUID id,
                          @Param("status") OutboxStatus status,
                          @Param("nextAttemptAt") Instant nextAttemptAt,
                          @Param("error") String error);
}
