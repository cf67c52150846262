package com.llamaservice.service;

/**
 * Raised by a {@link ModelActivator} when a generation call cannot complete.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
