package com.siteguard.application.exceptions;

/**
 * A catalog uniqueness conflict could not be resolved by re-reading the winning row.
 * Indicates a storage contract violation rather than a client error.
 */
public class CatalogConflictException extends RuntimeException {

    public CatalogConflictException(String message) {
        super(message);
    }

    public CatalogConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
