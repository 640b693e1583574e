package com.questrail.alpaca.api;

/**
 * Health-check seam consumed by the owning coordinator.
 */
public interface HealthChecker {

    String name();

    HealthCheckResult check();
}
