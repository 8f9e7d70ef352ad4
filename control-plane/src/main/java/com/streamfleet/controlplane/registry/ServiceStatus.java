package com.streamfleet.controlplane.registry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a registered service instance.
 * <p>
 * Instances move STARTING → HEALTHY → {UNHEALTHY, STOPPING} → STOPPED.
 * HEALTHY and UNHEALTHY flip back and forth as health probes succeed or fail.
 * </p>
 */
public enum ServiceStatus {
    STARTING,
    HEALTHY,
    UNHEALTHY,
    STOPPING,
    STOPPED;

    public boolean canTransitionTo(ServiceStatus next) {
        return allowedNext().contains(next);
    }

    /**
     * Whether the instance is still part of the fleet (not shutting down).
     */
    public boolean isActive() {
        return this == STARTING || this == HEALTHY || this == UNHEALTHY;
    }

    private Set<ServiceStatus> allowedNext() {
        switch (this) {
            case STARTING:
                return EnumSet.of(HEALTHY, STOPPING, STOPPED);
            case HEALTHY:
                return EnumSet.of(UNHEALTHY, STOPPING);
            case UNHEALTHY:
                return EnumSet.of(HEALTHY, STOPPING, STOPPED);
            case STOPPING:
                return EnumSet.of(STOPPED);
            default:
                return EnumSet.noneOf(ServiceStatus.class);
        }
    }
}
