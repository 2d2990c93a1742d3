package com.siteguard.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface IngestionAuditRepository extends JpaRepository<IngestionAuditRecord, Long> {

    List<IngestionAuditRecord> findBySiteIdOrderByReceivedAtDesc(UUID siteId);
}
