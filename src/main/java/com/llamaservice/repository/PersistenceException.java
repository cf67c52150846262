package com.llamaservice.repository;

/**
 * Raised when the model registry document cannot be read or written.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
