package com.streamfleet.controlplane.config;

import com.streamfleet.controlplane.registry.backend.DiscoveryBackendType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

import static com.streamfleet.controlplane.config.EnvSupport.getEnv;
import static com.streamfleet.controlplane.config.EnvSupport.getInt;
import static com.streamfleet.controlplane.config.EnvSupport.getSeconds;

/**
 * Service registry settings: which discovery backend to use and how often each loop runs.
 */
@Value
@Builder(toBuilder = true)
public class DiscoveryConfig {

    @Builder.Default
    DiscoveryBackendType backend = DiscoveryBackendType.MEMORY;
    @Builder.Default
    String serviceName = "websocket-server";

    @Builder.Default
    String consulHost = "localhost";
    @Builder.Default
    int consulPort = 8500;
    @Builder.Default
    String etcdHost = "localhost";
    @Builder.Default
    int etcdPort = 2379;
    @Builder.Default
    String redisUrl = "redis://localhost:6379";

    @Builder.Default
    Duration healthCheckInterval = Duration.ofSeconds(10);
    @Builder.Default
    Duration heartbeatInterval = Duration.ofSeconds(15);
    @Builder.Default
    Duration discoveryInterval = Duration.ofSeconds(30);

    // Outbound call bounds
    @Builder.Default
    Duration discoveryTimeout = Duration.ofSeconds(10);
    @Builder.Default
    Duration probeTimeout = Duration.ofSeconds(5);

    // Lease of a registered instance
    @Builder.Default
    Duration ttl = Duration.ofSeconds(30);

    public static DiscoveryConfig fromEnv() {
        return DiscoveryConfig.builder()
            .backend(DiscoveryBackendType.fromName(getEnv("DISCOVERY_BACKEND", "memory")))
            .serviceName(getEnv("SERVICE_NAME", "websocket-server"))
            .consulHost(getEnv("CONSUL_HOST", "localhost"))
            .consulPort(getInt("CONSUL_PORT", 8500))
            .etcdHost(getEnv("ETCD_HOST", "localhost"))
            .etcdPort(getInt("ETCD_PORT", 2379))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .healthCheckInterval(getSeconds("HEALTH_CHECK_INTERVAL_SEC", 10))
            .heartbeatInterval(getSeconds("HEARTBEAT_INTERVAL_SEC", 15))
            .discoveryInterval(getSeconds("DISCOVERY_INTERVAL_SEC", 30))
            .discoveryTimeout(getSeconds("DISCOVERY_TIMEOUT_SEC", 10))
            .probeTimeout(getSeconds("PROBE_TIMEOUT_SEC", 5))
            .ttl(getSeconds("SERVICE_TTL_SEC", 30))
            .build();
    }

    public void validate() {
        if (backend == null) {
            throw new ConfigurationException("Discovery backend must be set");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new ConfigurationException("Service name must not be blank");
        }
        EnvSupport.requirePositive("healthCheckInterval", healthCheckInterval);
        EnvSupport.requirePositive("heartbeatInterval", heartbeatInterval);
        EnvSupport.requirePositive("discoveryInterval", discoveryInterval);
        EnvSupport.requirePositive("discoveryTimeout", discoveryTimeout);
        EnvSupport.requirePositive("probeTimeout", probeTimeout);
        EnvSupport.requirePositive("ttl", ttl);
    }
}
