package com.streamfleet.controlplane.registry.backend;

import com.streamfleet.controlplane.config.ConfigurationException;

import java.util.Locale;

public enum DiscoveryBackendType {
    MEMORY,
    CONSUL,
    ETCD,
    REDIS;

    public static DiscoveryBackendType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown discovery backend '" + name + "'", e);
        }
    }
}
