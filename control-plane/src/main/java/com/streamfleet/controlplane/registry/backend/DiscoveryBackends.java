package com.streamfleet.controlplane.registry.backend;

import com.streamfleet.controlplane.config.DiscoveryConfig;

import java.time.Clock;

/**
 * Creates the discovery backend selected by configuration.
 */
public final class DiscoveryBackends {
    private DiscoveryBackends() {
    }

    public static IDiscoveryBackend create(DiscoveryConfig config, Clock clock) {
        switch (config.getBackend()) {
            case CONSUL:
                return new ConsulDiscoveryBackend(
                    config.getConsulHost(),
                    config.getConsulPort(),
                    config.getDiscoveryTimeout(),
                    config.getHealthCheckInterval(),
                    clock
                );
            case ETCD:
                return new EtcdDiscoveryBackend(config.getEtcdHost(), config.getEtcdPort(), config.getDiscoveryTimeout());
            case REDIS:
                return new RedisDiscoveryBackend(config.getRedisUrl(), config.getDiscoveryTimeout());
            case MEMORY:
            default:
                return new MemoryDiscoveryBackend(clock);
        }
    }
}
