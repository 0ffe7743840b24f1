package com.openguide.trip.domain.repository;

import com.openguide.trip.domain.model.CallEndReason;
import com.openguide.trip.domain.model.CallSession;
import com.openguide.trip.domain.model.CallStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface CallSessionRepository extends JpaRepository<CallSession, UUID> {

    /** Ends the session only if it is still ringing or ongoing. First writer wins; the loser sees 0. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CallSession c
            SET c.status = :ended, c.endReason = :reason, c.endedAt = :now,
                c.summary = :summary, c.negotiatedPrice = :price, c.updatedAt = :now
            WHERE c.id = :id AND c.status IN :live
            """)
    int endIfLive(@Param("id") UUID id,
                  @Param("ended") CallStatus ended,
                  @Param("reason") CallEndReason reason,
                  @Param("summary") String summary,
                  @Param("price") BigDecimal price,
                  @Param("now") Instant now,
                  @Param("live") Collection<CallStatus> live);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CallSession c
            SET c.status = :ongoing, c.updatedAt = :now
            WHERE c.id = :id AND c.status = :ringing
            """)
    int markOngoing(@Param("id") UUID id,
                    @Param("ringing") CallStatus ringing,
                    @Param("ongoing") CallStatus ongoing,
                    @Param("now") Instant now);

    List<CallSession> findByStatusInAndDeadlineAtLessThanEqual(Collection<CallStatus> statuses, Instant now);

    List<CallSession> findByStatusInAndDeadlineAtAfter(Collection<CallStatus> statuses, Instant now);
}
