package com.rebalancer.metrics.registry;

/**
 * Thrown when a metric cannot be registered, e.g. because a collector with
 * the same name already exists in the target registry.
 *
 * <p>This is a start-up configuration error; there is no degraded mode.
 */
public class MetricsRegistrationException extends RuntimeException {

    public MetricsRegistrationException(String message) {
        super(message);
    }

    public MetricsRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
