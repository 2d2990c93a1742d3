package com.siteguard.application;

import com.siteguard.application.exceptions.FieldViolation;
import com.siteguard.domain.model.Module;
import com.siteguard.domain.model.ModuleCategory;
import com.siteguard.domain.model.ModuleMetadata;
import com.siteguard.domain.model.ModuleVersion;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One installed module as reported in a manifest.
 *
 * @param machineName    unique machine name (required)
 * @param displayName    human-readable name
 * @param category       module category
 * @param enabled        whether the module is enabled (required)
 * @param version        installed version string (required)
 * @param securityUpdate asserted security flag, honoured only for trusted submitters
 * @param link           project link
 */
public record ModuleReport(
    String machineName,
    String displayName,
    ModuleCategory category,
    Boolean enabled,
    String version,
    Boolean securityUpdate,
    String link
) {

    public static final Pattern MACHINE_NAME = Pattern.compile("^[A-Za-z0-9_][A-Za-z0-9_.-]*$");

    public ModuleMetadata metadata() {
        return new ModuleMetadata(displayName, category, link);
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean assertsSecurityUpdate() {
        return Boolean.TRUE.equals(securityUpdate);
    }

    /**
     * Structural problems with this report, with field paths relative to the manifest.
     */
    public List<FieldViolation> violations(int index) {
        String prefix = "modules[" + index + "].";
        List<FieldViolation> violations = new ArrayList<>();

        if (machineName == null || machineName.isBlank()) {
            violations.add(new FieldViolation(prefix + "machineName", "must not be blank", machineName));
        } else if (machineName.length() > Module.MAX_MACHINE_NAME_LENGTH) {
            violations.add(new FieldViolation(prefix + "machineName",
                "must be at most " + Module.MAX_MACHINE_NAME_LENGTH + " characters", null));
        } else if (!MACHINE_NAME.matcher(machineName).matches()) {
            violations.add(new FieldViolation(prefix + "machineName",
                "may only contain letters, digits, '_', '.' and '-'", machineName));
        }

        if (version == null || version.isBlank()) {
            violations.add(new FieldViolation(prefix + "version", "must not be blank", version));
        } else if (version.trim().length() > ModuleVersion.MAX_VERSION_LENGTH) {
            violations.add(new FieldViolation(prefix + "version",
                "must be at most " + ModuleVersion.MAX_VERSION_LENGTH + " characters", null));
        }

        if (enabled == null) {
            violations.add(new FieldViolation(prefix + "enabled", "must not be null", null));
        }
        return violations;
    }
}
