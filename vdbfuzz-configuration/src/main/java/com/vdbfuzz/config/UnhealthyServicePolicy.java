package com.vdbfuzz.config;

/** How a service that is unhealthy at dispatch time appears in a test result. */
public enum UnhealthyServicePolicy {
    /** Omitted from the results and listed as excluded. */
    EXCLUDE,
    /** Recorded as a failed result with error kind {@code unhealthy}. */
    RECORD_AS_FAILED
}
