package com.siteguard.application.exceptions;

/**
 * Storage was temporarily unavailable or the synchronization timed out. Nothing was applied;
 * the caller may retry the whole submission.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
