package com.vdbfuzz.config;

/** When the health monitor re-probes services. */
public enum HealthMode {
    /** Probe at run start; re-probe only services that lost their connection mid-run. */
    DEFAULT,
    /** Re-probe every service before every batch. */
    STRICT
}
