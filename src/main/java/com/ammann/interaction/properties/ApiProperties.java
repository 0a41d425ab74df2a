/* (C)2026 */
package com.ammann.interaction.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Detection context endpoints
     */
    public static final class Contexts {
        private Contexts() {}

        public static final String BASE = "/contexts";
        public static final String BY_NAME = BASE + "/{name}";
    }

    /**
     * Configured interaction template endpoints
     */
    public static final class Interactions {
        private Interactions() {}

        public static final String BASE = "/interactions";
    }
}
