package com.siteguard.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Authoritative release publication from the catalog feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogReleasesRequest {

    @NotNull(message = "Release list is required")
    @Valid
    private List<@NotNull(message = "Release must not be null") Release> releases;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Release {

        @NotBlank(message = "Machine name is required")
        @Size(max = 255, message = "Machine name must not exceed 255 characters")
        @Pattern(regexp = ManifestRequest.MACHINE_NAME_PATTERN,
            message = "Machine name may only contain letters, digits, '_', '.' and '-'")
        private String machineName;

        @Size(max = 255, message = "Display name must not exceed 255 characters")
        private String displayName;

        @Pattern(regexp = ManifestRequest.CATEGORY_PATTERN, message = "Category must be one of core, contrib, custom")
        private String category;

        @Size(max = 500, message = "Link must not exceed 500 characters")
        private String link;

        @NotBlank(message = "Version is required")
        @Size(max = 100, message = "Version must not exceed 100 characters")
        private String version;

        private LocalDate releaseDate;

        @NotNull(message = "Security flag is required")
        private Boolean securityUpdate;
    }
}
