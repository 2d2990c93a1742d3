package com.siteguard.interfaces.api;

import com.siteguard.application.ManifestIngestionService;
import com.siteguard.interfaces.api.dto.ErrorResponse;
import com.siteguard.interfaces.api.dto.ManifestRequest;
import com.siteguard.interfaces.api.dto.ManifestSubmissionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for site manifest submissions.
 *
 * <p>The body is taken raw so that size limits, malformed JSON and structural violations are
 * all reported in one format, and so the exact payload can be audited.
 */
@RestController
@RequestMapping("/api/v1/manifests")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Manifests", description = "Site module inventory submissions")
public class ManifestController {

    private final ManifestIngestionService ingestionService;

    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Submit a site manifest",
        description = "Replaces the site's module inventory with the reported one, recomputes update flags "
            + "and the security score, and records a patch run when anything changed",
        requestBody = @RequestBody(content = @Content(schema = @Schema(implementation = ManifestRequest.class)))
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Manifest applied",
            content = @Content(schema = @Schema(implementation = ManifestSubmissionResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed or invalid manifest, nothing applied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Principal may not submit for this site",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Site not registered",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Storage unavailable or lock timeout, retry later",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ManifestSubmissionResponse> submitManifest(
            @org.springframework.web.bind.annotation.RequestBody(required = false) String body) {

        if (log.isDebugEnabled()) {
            log.debug("Received manifest: {} characters", body == null ? 0 : body.length());
        }

        ManifestSubmissionResponse response = ingestionService.submit(body);

        if (log.isInfoEnabled()) {
            log.info("Manifest processed: siteId={}, changed={}, score={}",
                response.getSiteId(), response.isChanged(), response.getSecurityScore());
        }

        return ResponseEntity.ok(response);
    }
}
