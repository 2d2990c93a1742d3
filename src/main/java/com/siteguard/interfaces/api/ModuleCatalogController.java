package com.siteguard.interfaces.api;

import com.siteguard.application.ModuleCatalogQueryService;
import com.siteguard.application.exceptions.InvalidQueryParameterException;
import com.siteguard.domain.model.ModuleCategory;
import com.siteguard.domain.repository.ModuleSearchCriteria;
import com.siteguard.interfaces.api.dto.ErrorResponse;
import com.siteguard.interfaces.api.dto.ModuleSummaryResponse;
import com.siteguard.interfaces.api.dto.ModuleVersionResponse;
import com.siteguard.interfaces.api.dto.PageResponse;
import com.siteguard.interfaces.api.dto.VersionComparisonResponse;
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

import java.util.List;
import java.util.Set;

/**
 * REST controller for the shared module catalog.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Modules", description = "Module catalog and version ordering")
public class ModuleCatalogController {

    private static final Set<String> SORTABLE = Set.of("displayName", "machineName");

    private final ModuleCatalogQueryService queryService;

    @GetMapping(value = "/modules", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List modules", description = "Pages through catalog modules, optionally filtered")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Page of modules"
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Unknown category, sort field or paging values",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PageResponse<ModuleSummaryResponse>> listModules(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) Boolean hasSecurityUpdate,
            @RequestParam(defaultValue = "machineName") String sort,
            @RequestParam(defaultValue = "ASC") Sort.Direction direction,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int size) {

        if (!SORTABLE.contains(sort)) {
            throw new InvalidQueryParameterException("Unsupported sort field: " + sort);
        }
        ModuleCategory moduleCategory = category == null ? null : ModuleCategory.fromWireValue(category)
            .orElseThrow(() -> new InvalidQueryParameterException("Unknown category: " + category));

        Sort order = Sort.by(direction, sort);
        if (!"machineName".equals(sort)) {
            order = order.and(Sort.by(Sort.Direction.ASC, "machineName"));
        }

        return ResponseEntity.ok(queryService.listModules(
            new ModuleSearchCriteria(moduleCategory, hasSecurityUpdate),
            PageRequest.of(page, size, order)));
    }

    @GetMapping(value = "/modules/{machineName}/versions", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List module versions", description = "Known versions of a module, newest first")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Versions of the module"
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Module not in the catalog",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<List<ModuleVersionResponse>> listVersions(@PathVariable String machineName) {
        return ResponseEntity.ok(queryService.listVersions(machineName));
    }

    @GetMapping(value = "/versions/compare", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Compare two versions",
        description = "Reports precedence, branch and upgrade relation of two version strings")
    @ApiResponse(
        responseCode = "200",
        description = "Comparison result",
        content = @Content(schema = @Schema(implementation = VersionComparisonResponse.class))
    )
    public ResponseEntity<VersionComparisonResponse> compare(@RequestParam String left, @RequestParam String right) {
        return ResponseEntity.ok(queryService.compare(left, right));
    }
}
