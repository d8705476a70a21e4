package com.ammann.hashbreaker.exception;

/**
 * The external cracking tool could not be launched, or its invocation was interrupted.
 *
 * <p>Phase strategies convert this into a failed phase result; it never reaches the HTTP layer.
 */
public class CrackingToolException extends ApiException {

    public CrackingToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
