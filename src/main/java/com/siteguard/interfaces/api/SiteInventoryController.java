package com.siteguard.interfaces.api;

import com.siteguard.application.SiteInventoryQueryService;
import com.siteguard.interfaces.api.dto.ErrorResponse;
import com.siteguard.interfaces.api.dto.PageResponse;
import com.siteguard.interfaces.api.dto.PatchRunResponse;
import com.siteguard.interfaces.api.dto.SecuritySummaryResponse;
import com.siteguard.interfaces.api.dto.SiteModuleResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for per-site reporting.
 *
 * Access:
 * - The site itself
 * - Users of the site's organization
 */
@RestController
@RequestMapping("/api/v1/sites/{siteId}")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Sites", description = "Site inventory, patch history and security posture")
public class SiteInventoryController {

    private final SiteInventoryQueryService queryService;

    @GetMapping(value = "/modules", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List site modules", description = "Installed modules with their update flags")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Page of installed modules"),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Site not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PageResponse<SiteModuleResponse>> listModules(
            @PathVariable UUID siteId,
            @RequestParam(required = false) Boolean updateAvailable,
            @RequestParam(required = false) Boolean securityUpdateAvailable,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int size) {

        if (log.isDebugEnabled()) {
            log.debug("Listing modules: siteId={}, updateAvailable={}, securityUpdateAvailable={}",
                siteId, updateAvailable, securityUpdateAvailable);
        }

        return ResponseEntity.ok(queryService.listModules(siteId, updateAvailable, securityUpdateAvailable,
            PageRequest.of(page, size, Sort.by("module.machineName"))));
    }

    @GetMapping(value = "/patch-runs", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List patch runs", description = "Recorded synchronizations that changed the site, newest first")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Page of patch runs"),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Site not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PageResponse<PatchRunResponse>> listPatchRuns(
            @PathVariable UUID siteId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {

        return ResponseEntity.ok(queryService.listPatchRuns(siteId, PageRequest.of(page, size)));
    }

    @GetMapping(value = "/security-summary", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Security summary", description = "Counters and score from the last synchronization")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Security summary",
            content = @Content(schema = @Schema(implementation = SecuritySummaryResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Site not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<SecuritySummaryResponse> securitySummary(@PathVariable UUID siteId) {
        return ResponseEntity.ok(queryService.securitySummary(siteId));
    }
}
