package com.siteguard.application.exceptions;

/**
 * One field-level validation failure, e.g. {@code modules[3].version: must not be blank}.
 */
public record FieldViolation(String field, String message, Object rejectedValue) {
}
