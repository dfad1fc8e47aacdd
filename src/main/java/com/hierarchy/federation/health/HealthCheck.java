package com.hierarchy.federation.health;

/**
 * A single health check of one federation component.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
