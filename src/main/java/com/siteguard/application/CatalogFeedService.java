package com.siteguard.application;

import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.application.exceptions.SiteAccessDeniedException;
import com.siteguard.application.exceptions.TransientStorageException;
import com.siteguard.config.PerformanceConfiguration.BusinessMetrics;
import com.siteguard.config.SiteGuardProperties;
import com.siteguard.infrastructure.audit.AuditEntry;
import com.siteguard.infrastructure.audit.AuditService;
import com.siteguard.infrastructure.audit.AuditStatus;
import com.siteguard.infrastructure.security.SecurityContext;
import com.siteguard.infrastructure.security.SecurityKernel;
import com.siteguard.interfaces.api.ManifestParser;
import com.siteguard.interfaces.api.dto.CatalogPublicationResponse;
import com.siteguard.interfaces.api.dto.CatalogReleasesRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.List;

/**
 * Entry point of the authoritative catalog feed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogFeedService {

    static final String SUBMISSION_TYPE = "CATALOG_RELEASES";

    private final ManifestParser manifestParser;
    private final CatalogReleasePublisher releasePublisher;
    private final SecurityContextProvider securityContextProvider;
    private final SecurityKernel securityKernel;
    private final AuditService auditService;
    private final SiteGuardProperties properties;
    private final BusinessMetrics businessMetrics;

    public CatalogPublicationResponse publish(String body) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        Integer releasesReported = null;

        try {
            securityKernel.authorizeCatalogFeed(context);

            int maxChars = properties.getIngestion().getMaxPayloadChars();
            if (body != null && body.length() > maxChars) {
                throw new ManifestValidationException("Payload exceeds " + maxChars + " characters");
            }
            CatalogReleasesRequest request = manifestParser.parse(body, CatalogReleasesRequest.class);
            releasesReported = request.getReleases().size();
            if (releasesReported > properties.getIngestion().getMaxModules()) {
                throw new ManifestValidationException("Release list exceeds the maximum size",
                    List.of(new FieldViolation("releases",
                        "must contain at most " + properties.getIngestion().getMaxModules() + " releases", null)));
            }

            CatalogPublicationResult result = releasePublisher.publish(manifestParser.toReleases(request));

            audit(context, AuditStatus.SUCCESS, releasesReported, body,
                "versionsCreated=" + result.versionsCreated() + ", versionsPromoted=" + result.versionsPromoted());
            return CatalogPublicationResponse.builder()
                .releasesProcessed(result.releasesProcessed())
                .modulesCreated(result.modulesCreated())
                .versionsCreated(result.versionsCreated())
                .versionsPromoted(result.versionsPromoted())
                .sitesReevaluated(result.sitesReevaluated())
                .build();

        } catch (ManifestValidationException e) {
            log.warn("Catalog releases rejected: principal={}, reason={}", context.getPrincipalId(), e.getMessage());
            audit(context, AuditStatus.VALIDATION_ERROR, releasesReported, body, e.getMessage());
            throw e;
        } catch (SiteAccessDeniedException e) {
            audit(context, AuditStatus.REJECTED, releasesReported, body, e.getMessage());
            throw e;
        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | CannotCreateTransactionException | TransactionTimedOutException e) {
            log.warn("Catalog publication failed transiently: cause={}", e.getClass().getSimpleName());
            audit(context, AuditStatus.FAILED, releasesReported, body,
                "Transient storage failure: " + e.getClass().getSimpleName());
            throw new TransientStorageException("Storage temporarily unavailable, retry the publication", e);
        } catch (RuntimeException e) {
            log.error("Catalog publication failed: principal={}", context.getPrincipalId(), e);
            audit(context, AuditStatus.FAILED, releasesReported, body,
                "Failure: " + e.getClass().getSimpleName());
            throw e;
        }
    }

    private void audit(SecurityContext context, AuditStatus status, Integer releasesReported,
                       String body, String detail) {
        businessMetrics.recordSubmission(SUBMISSION_TYPE, status.name());
        String payload = body;
        int maxChars = properties.getIngestion().getMaxPayloadChars();
        if (payload != null && payload.length() > maxChars) {
            payload = payload.substring(0, maxChars);
        }
        auditService.record(new AuditEntry(context, null, SUBMISSION_TYPE, status, releasesReported, payload, detail));
    }
}
