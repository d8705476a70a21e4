package com.ammann.hashbreaker.exception;

import com.ammann.hashbreaker.enumeration.JobStatus;

/**
 * The requested transition is not allowed because the job already finished.
 *
 * <p>Mapped to HTTP 409 by {@link GlobalExceptionHandler}.
 */
public class JobAlreadyTerminalException extends ApiException {

    public JobAlreadyTerminalException(String jobId, JobStatus status) {
        super(String.format("Job %s is already %s", jobId, status));
    }
}
