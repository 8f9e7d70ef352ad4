package com.streamfleet.controlplane.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A registered backend server process as seen by the service registry.
 * <p>
 * Immutable; status changes produce a new instance through {@link #transitionTo(ServiceStatus)}.
 * The same document is stored in key/value discovery backends.
 * </p>
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceInstance {
    String id;
    String name;
    String host;
    int port;
    @Builder.Default
    List<String> tags = List.of();
    @Builder.Default
    Map<String, String> metadata = Map.of();
    String healthCheckUrl;
    @Builder.Default
    ServiceStatus status = ServiceStatus.STARTING;
    Instant registeredAt;
    Instant lastHeartbeat;
    @Builder.Default
    Duration ttl = Duration.ofSeconds(30);

    /**
     * Deterministic id used when the caller does not supply one.
     */
    public static String defaultId(String serviceName, String host, int port) {
        return serviceName + "-" + host + "-" + port;
    }

    /**
     * Returns a copy in {@code next} status.
     *
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public ServiceInstance transitionTo(ServiceStatus next) {
        if (status == next) {
            return this;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Instance " + id + " cannot move from " + status + " to " + next);
        }
        return withStatus(next);
    }

    @JsonIgnore
    public String getAddress() {
        return host + ":" + port;
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == ServiceStatus.HEALTHY;
    }
}
