package com.phillippitts.ambientscribe.exception;

/**
 * Base exception for all ambientscribe application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AmbientScribeException extends RuntimeException {

    public AmbientScribeException(String message) {
        super(message);
    }

    public AmbientScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public AmbientScribeException(Throwable cause) {
        super(cause);
    }
}
