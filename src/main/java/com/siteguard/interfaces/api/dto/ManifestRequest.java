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

import java.util.List;
import java.util.UUID;

/**
 * Inbound module manifest of one site.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManifestRequest {

    public static final String MACHINE_NAME_PATTERN = "^[A-Za-z0-9_][A-Za-z0-9_.-]*$";
    public static final String CATEGORY_PATTERN = "(?i)core|contrib|custom";

    @NotNull(message = "Site is required")
    @Valid
    private SiteInfo site;

    @Valid
    private PlatformInfo platform;

    @NotNull(message = "Module list is required")
    @Valid
    private List<@NotNull(message = "Module report must not be null") ModuleEntry> modules;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SiteInfo {

        @NotNull(message = "Site id is required")
        private UUID id;

        // url and name are accepted from existing agents but site management owns the stored values
        @Size(max = 500, message = "Site URL must not exceed 500 characters")
        private String url;

        @Size(max = 255, message = "Site name must not exceed 255 characters")
        private String name;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlatformInfo {

        @Size(max = 100, message = "Core version must not exceed 100 characters")
        private String coreVersion;

        @Size(max = 100, message = "Runtime version must not exceed 100 characters")
        private String runtimeVersion;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModuleEntry {

        @NotBlank(message = "Machine name is required")
        @Size(max = 255, message = "Machine name must not exceed 255 characters")
        @Pattern(regexp = MACHINE_NAME_PATTERN, message = "Machine name may only contain letters, digits, '_', '.' and '-'")
        private String machineName;

        @Size(max = 255, message = "Display name must not exceed 255 characters")
        private String displayName;

        @Pattern(regexp = CATEGORY_PATTERN, message = "Category must be one of core, contrib, custom")
        private String category;

        @NotNull(message = "Enabled flag is required")
        private Boolean enabled;

        @NotBlank(message = "Version is required")
        @Size(max = 100, message = "Version must not exceed 100 characters")
        private String version;

        private Boolean securityUpdate;

        @Size(max = 500, message = "Link must not exceed 500 characters")
        private String link;
    }
}
