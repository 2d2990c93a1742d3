package com.siteguard.application;

import com.siteguard.application.exceptions.CatalogConflictException;
import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.application.exceptions.SiteAccessDeniedException;
import com.siteguard.application.exceptions.SiteNotFoundException;
import com.siteguard.application.exceptions.TransientStorageException;
import com.siteguard.config.PerformanceConfiguration.BusinessMetrics;
import com.siteguard.config.SiteGuardProperties;
import com.siteguard.infrastructure.audit.AuditEntry;
import com.siteguard.infrastructure.audit.AuditService;
import com.siteguard.infrastructure.audit.AuditStatus;
import com.siteguard.infrastructure.security.SecurityContext;
import com.siteguard.interfaces.api.ManifestParser;
import com.siteguard.interfaces.api.dto.ManifestRequest;
import com.siteguard.interfaces.api.dto.ManifestSubmissionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.List;
import java.util.UUID;

/**
 * Ingestion boundary for site manifests.
 *
 * <p>Flow:
 * <ol>
 *   <li>Reject oversized, malformed or structurally invalid payloads before any write</li>
 *   <li>Run the synchronization as one transaction ({@link SiteSynchronizationService})</li>
 *   <li>Audit the raw payload with its outcome, whatever the outcome</li>
 *   <li>Translate storage failures into {@link TransientStorageException}</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManifestIngestionService {

    static final String SUBMISSION_TYPE = "MANIFEST";

    private final ManifestParser manifestParser;
    private final SiteSynchronizationService synchronizationService;
    private final SecurityContextProvider securityContextProvider;
    private final AuditService auditService;
    private final SiteGuardProperties properties;
    private final BusinessMetrics businessMetrics;

    public ManifestSubmissionResponse submit(String body) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        UUID siteId = null;
        Integer modulesReported = null;

        try {
            checkPayloadSize(body);
            ManifestRequest request = manifestParser.parse(body, ManifestRequest.class);
            siteId = request.getSite().getId();
            modulesReported = request.getModules().size();
            checkModuleCount(modulesReported);

            SynchronizationOutcome outcome = synchronizationService.synchronize(context, manifestParser.toManifest(request));

            if (outcome.patchRunId() != null) {
                businessMetrics.recordPatchRun(outcome.result().modulesUpdated(),
                    outcome.result().securityPatchesApplied());
            }
            audit(context, siteId, AuditStatus.SUCCESS, modulesReported, body,
                "changed=" + outcome.result().changed() + ", patchRunId=" + outcome.patchRunId());
            log.info("Manifest accepted: siteId={}, modules={}, changed={}, score={}",
                siteId, modulesReported, outcome.result().changed(), outcome.posture().score());
            return toResponse(outcome);

        } catch (ManifestValidationException e) {
            log.warn("Manifest rejected: siteId={}, reason={}, violations={}",
                siteId, e.getMessage(), e.getViolations().size());
            audit(context, siteId, AuditStatus.VALIDATION_ERROR, modulesReported, body, describe(e));
            throw e;
        } catch (SiteAccessDeniedException | SiteNotFoundException e) {
            log.warn("Manifest rejected: siteId={}, principal={}, reason={}",
                siteId, context.getPrincipalId(), e.getMessage());
            audit(context, siteId, AuditStatus.REJECTED, modulesReported, body, e.getMessage());
            throw e;
        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | CannotCreateTransactionException | TransactionTimedOutException e) {
            log.warn("Manifest synchronization failed transiently: siteId={}, cause={}",
                siteId, e.getClass().getSimpleName());
            audit(context, siteId, AuditStatus.FAILED, modulesReported, body,
                "Transient storage failure: " + e.getClass().getSimpleName());
            throw new TransientStorageException("Storage temporarily unavailable, retry the submission", e);
        } catch (CatalogConflictException e) {
            audit(context, siteId, AuditStatus.FAILED, modulesReported, body, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Manifest synchronization failed: siteId={}", siteId, e);
            audit(context, siteId, AuditStatus.FAILED, modulesReported, body,
                "Unexpected failure: " + e.getClass().getSimpleName());
            throw e;
        }
    }

    private void checkPayloadSize(String body) {
        int maxChars = properties.getIngestion().getMaxPayloadChars();
        if (body != null && body.length() > maxChars) {
            throw new ManifestValidationException("Payload exceeds " + maxChars + " characters");
        }
    }

    private void checkModuleCount(int modulesReported) {
        int maxModules = properties.getIngestion().getMaxModules();
        if (modulesReported > maxModules) {
            throw new ManifestValidationException("Manifest exceeds the maximum module count",
                List.of(new FieldViolation("modules", "must contain at most " + maxModules + " modules", null)));
        }
    }

    private void audit(SecurityContext context, UUID siteId, AuditStatus status,
                       Integer modulesReported, String body, String detail) {
        businessMetrics.recordSubmission(SUBMISSION_TYPE, status.name());
        auditService.record(new AuditEntry(context, siteId, SUBMISSION_TYPE, status, modulesReported,
            truncatePayload(body), detail));
    }

    private String truncatePayload(String body) {
        int maxChars = properties.getIngestion().getMaxPayloadChars();
        if (body == null || body.length() <= maxChars) {
            return body;
        }
        return body.substring(0, maxChars);
    }

    private static String describe(ManifestValidationException e) {
        if (e.getViolations().isEmpty()) {
            return e.getMessage();
        }
        StringBuilder detail = new StringBuilder(e.getMessage()).append(':');
        for (FieldViolation violation : e.getViolations()) {
            detail.append(' ').append(violation.field()).append(' ').append(violation.message()).append(';');
        }
        return detail.toString();
    }

    private static ManifestSubmissionResponse toResponse(SynchronizationOutcome outcome) {
        SyncResult result = outcome.result();
        return ManifestSubmissionResponse.builder()
            .siteId(outcome.siteId())
            .changed(result.changed())
            .modulesProcessed(result.modulesProcessed())
            .modulesAdded(result.modulesAdded())
            .modulesRemoved(result.modulesRemoved())
            .modulesUpdated(result.modulesUpdated())
            .securityPatchesApplied(result.securityPatchesApplied())
            .securityScore(outcome.posture().score())
            .totalModulesCount(outcome.posture().totalModules())
            .securityUpdatesCount(outcome.posture().securityUpdates())
            .nonSecurityUpdatesCount(outcome.posture().nonSecurityUpdates())
            .patchRunId(outcome.patchRunId())
            .build();
    }
}
