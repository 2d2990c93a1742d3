package com.siteguard.domain.repository;

/**
 * Raised by the catalog port when an insert hits a uniqueness constraint because a
 * concurrent writer created the same entry first.
 */
public class DuplicateCatalogEntryException extends RuntimeException {

    public DuplicateCatalogEntryException(String message) {
        super(message);
    }

    public DuplicateCatalogEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
