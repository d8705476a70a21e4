/* (C)2026 */
package com.ammann.hashbreaker.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Job endpoints
     */
    public static final class Jobs {
        private Jobs() {}

        public static final String BASE = "/jobs";
        public static final String BY_ID = "/{jobId}";
        public static final String CANCEL = BY_ID + "/cancel";
    }
}
