package com.ammann.hashbreaker.exception;

/**
 * Failure to read or write job state in the backing store.
 *
 * <p>Mapped to HTTP 503 by {@link GlobalExceptionHandler}. Inside a worker it escapes the
 * pipeline and causes redelivery.
 */
public class JobStoreException extends ApiException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
