package com.openguide.trip.domain.repository;

import com.openguide.trip.domain.model.AuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, UUID> {
    List<AuditRecord> findByResourceTypeAndResourceIdOrderByCreatedAtAsc(String resourceType, String resourceId);
}
