package com.myorg.docinsight.exception;

/**
 * Rejected client input (missing files, wrong content type, blank persona...).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
