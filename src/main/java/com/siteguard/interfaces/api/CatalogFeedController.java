package com.siteguard.interfaces.api;

import com.siteguard.application.CatalogFeedService;
import com.siteguard.interfaces.api.dto.CatalogPublicationResponse;
import com.siteguard.interfaces.api.dto.CatalogReleasesRequest;
import com.siteguard.interfaces.api.dto.ErrorResponse;
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
 * REST controller for the authoritative release feed. Only the catalog feed principal may publish.
 */
@RestController
@RequestMapping("/api/v1/catalog")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Catalog", description = "Authoritative release publication")
public class CatalogFeedController {

    private final CatalogFeedService catalogFeedService;

    @PostMapping(
        value = "/releases",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Publish releases",
        description = "Records release dates and security flags for module versions and re-evaluates every site "
            + "running an affected module",
        requestBody = @RequestBody(content = @Content(schema = @Schema(implementation = CatalogReleasesRequest.class)))
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Releases applied",
            content = @Content(schema = @Schema(implementation = CatalogPublicationResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed or invalid release list, nothing applied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Principal is not the catalog feed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Storage unavailable or lock timeout, retry later",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<CatalogPublicationResponse> publishReleases(
            @org.springframework.web.bind.annotation.RequestBody(required = false) String body) {

        CatalogPublicationResponse response = catalogFeedService.publish(body);

        if (log.isInfoEnabled()) {
            log.info("Catalog releases published: releases={}, versionsCreated={}, versionsPromoted={}, sites={}",
                response.getReleasesProcessed(), response.getVersionsCreated(),
                response.getVersionsPromoted(), response.getSitesReevaluated());
        }

        return ResponseEntity.ok(response);
    }
}
