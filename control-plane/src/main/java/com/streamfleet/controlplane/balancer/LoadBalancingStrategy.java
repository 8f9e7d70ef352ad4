package com.streamfleet.controlplane.balancer;

import com.streamfleet.controlplane.config.ConfigurationException;

import java.util.Locale;

public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    LEAST_CONNECTIONS,
    WEIGHTED_ROUND_ROBIN,
    CONSISTENT_HASH,
    RESOURCE_BASED;

    public static LoadBalancingStrategy fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown load balancing strategy '" + name + "'", e);
        }
    }
}
