package com.rollup.service.ingest;

/**
 * Thrown by analytics endpoints while {@code rollup.enabled} is off.
 */
public class AnalyticsDisabledException extends RuntimeException {

    public static final String ERROR_CODE = "ANALYTICS_DISABLED";

    public AnalyticsDisabledException() {
        super("Analytics is disabled");
    }
}
