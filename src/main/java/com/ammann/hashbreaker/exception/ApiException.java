package com.ammann.hashbreaker.exception;

/**
 * Base unchecked exception for all application-level errors in the hash breaker.
 *
 * <p>Subclasses represent specific error categories (validation, unknown jobs, job store or
 * cracking tool failures) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }
}
