package com.questrail.alpaca.api;

/**
 * Coarse health of a component as reported to the coordinator's health
 * aggregation.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    UNKNOWN
}
