package com.siteguard.application.exceptions;

/**
 * A query parameter names a value the API does not support (sort field, category).
 * The message is returned to the caller.
 */
public class InvalidQueryParameterException extends RuntimeException {

    public InvalidQueryParameterException(String message) {
        super(message);
    }
}
