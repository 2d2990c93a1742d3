package com.siteguard.interfaces.api;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteguard.application.CatalogRelease;
import com.siteguard.application.Manifest;
import com.siteguard.application.ModuleReport;
import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.application.exceptions.ManifestValidationException;
import com.siteguard.domain.model.ModuleCategory;
import com.siteguard.domain.model.ModuleMetadata;
import com.siteguard.interfaces.api.dto.CatalogReleasesRequest;
import com.siteguard.interfaces.api.dto.ManifestRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses raw request bodies and validates them structurally.
 *
 * <p>Bodies are taken as strings so the audit log can keep the payload exactly as received,
 * including payloads that are not valid JSON.
 */
@Component
@RequiredArgsConstructor
public class ManifestParser {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    /**
     * @throws ManifestValidationException if the body is empty, not valid JSON for {@code type},
     *                                     or violates its constraints
     */
    public <T> T parse(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new ManifestValidationException("Request body must not be empty");
        }

        T request;
        try {
            request = objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ManifestValidationException("Malformed JSON" + describe(e.getLocation()), e);
        }
        if (request == null) {
            throw new ManifestValidationException("Request body must be a JSON object");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            List<FieldViolation> fieldViolations = violations.stream()
                .map(violation -> new FieldViolation(
                    violation.getPropertyPath().toString(),
                    violation.getMessage(),
                    violation.getInvalidValue() instanceof String ? violation.getInvalidValue() : null))
                .sorted(Comparator.comparing(FieldViolation::field))
                .collect(Collectors.toList());
            throw new ManifestValidationException("Request failed validation", fieldViolations);
        }
        return request;
    }

    public Manifest toManifest(ManifestRequest request) {
        ManifestRequest.PlatformInfo platform = request.getPlatform();
        List<ModuleReport> modules = request.getModules().stream()
            .map(entry -> new ModuleReport(
                entry.getMachineName().trim(),
                entry.getDisplayName(),
                category(entry.getCategory()),
                entry.getEnabled(),
                entry.getVersion().trim(),
                entry.getSecurityUpdate(),
                entry.getLink()))
            .collect(Collectors.toList());

        return new Manifest(
            request.getSite().getId(),
            platform != null ? platform.getCoreVersion() : null,
            platform != null ? platform.getRuntimeVersion() : null,
            modules
        );
    }

    public List<CatalogRelease> toReleases(CatalogReleasesRequest request) {
        return request.getReleases().stream()
            .map(release -> new CatalogRelease(
                release.getMachineName().trim(),
                new ModuleMetadata(release.getDisplayName(), category(release.getCategory()), release.getLink()),
                release.getVersion().trim(),
                release.getReleaseDate(),
                release.getSecurityUpdate()))
            .collect(Collectors.toList());
    }

    private static ModuleCategory category(String value) {
        return ModuleCategory.fromWireValue(value).orElse(null);
    }

    private static String describe(JsonLocation location) {
        if (location == null || location.getLineNr() < 0) {
            return "";
        }
        return " at line " + location.getLineNr() + ", column " + location.getColumnNr();
    }
}
