package ai.pipestream.supervisor.entity;

/**
 * Health of a registered service as reported by its heartbeats or inferred by the sweep.
 */
public enum HealthStatus {
    /** Registered but no healthy report yet */
    STARTING,
    /** Fully operational */
    HEALTHY,
    /** Some checks failing, still serving */
    DEGRADED,
    /** Reported unhealthy or silent past the heartbeat timeout */
    UNHEALTHY,
    /** Unregistered; terminal */
    STOPPED;

    /**
     * Whether the service counts towards system readiness.
     * @return true for HEALTHY and DEGRADED
     */
    public boolean isOperational() {
        return this == HEALTHY || this == DEGRADED;
    }

    /**
     * Whether a worker may report this status in a heartbeat. STARTING is only entered on
     * registration and STOPPED only on unregistration.
     */
    public boolean isReportable() {
        return this == HEALTHY || this == DEGRADED || this == UNHEALTHY;
    }
}
