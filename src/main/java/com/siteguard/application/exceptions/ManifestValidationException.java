package com.siteguard.application.exceptions;

import java.util.List;

/**
 * The manifest was malformed or structurally invalid. Raised before any state is written.
 */
public class ManifestValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public ManifestValidationException(String message) {
        this(message, List.of());
    }

    public ManifestValidationException(String message, List<FieldViolation> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public ManifestValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
