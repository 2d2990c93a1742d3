package com.siteguard.infrastructure.audit;

import com.siteguard.infrastructure.security.SecurityContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Service
@Slf4j
public class DefaultAuditService implements AuditService {

    static final int MAX_DETAIL_LENGTH = 2000;

    private final IngestionAuditRepository repository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public DefaultAuditService(IngestionAuditRepository repository,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.repository = repository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Override
    public void record(AuditEntry entry) {
        SecurityContext context = entry.context();
        log.info("AUDIT type={} status={} siteId={} principal={} requestId={}",
            entry.submissionType(), entry.status(), entry.siteId(),
            context.getPrincipalId(), context.getRequestId());

        IngestionAuditRecord auditRecord = IngestionAuditRecord.builder()
            .requestId(context.getRequestId())
            .siteId(entry.siteId())
            .principalId(context.getPrincipalId())
            .principalType(context.getPrincipalType() != null ? context.getPrincipalType().name() : null)
            .sourceIp(context.getSourceIp())
            .submissionType(entry.submissionType())
            .status(entry.status())
            .modulesReported(entry.modulesReported())
            .payload(entry.payload())
            .detail(truncate(entry.detail()))
            .receivedAt(clock.instant())
            .build();

        try {
            requiresNew.executeWithoutResult(status -> repository.save(auditRecord));
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to persist audit record: type={}, status={}, siteId={}",
                entry.submissionType(), entry.status(), entry.siteId(), e);
        }
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }
}
