package com.myorg.choirsplit.exception;

/**
 * Invalid input handed to the service surface: a missing upload, a wrong file type,
 * an unparseable part string.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
