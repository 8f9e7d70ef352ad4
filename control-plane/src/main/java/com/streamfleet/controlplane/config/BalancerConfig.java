package com.streamfleet.controlplane.config;

import com.streamfleet.controlplane.balancer.LoadBalancingStrategy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

import static com.streamfleet.controlplane.config.EnvSupport.getDouble;
import static com.streamfleet.controlplane.config.EnvSupport.getEnv;
import static com.streamfleet.controlplane.config.EnvSupport.getInt;
import static com.streamfleet.controlplane.config.EnvSupport.getSeconds;

/**
 * Load balancer settings: selection strategy, rate limit and node health rule.
 */
@Value
@Builder(toBuilder = true)
public class BalancerConfig {

    @Builder.Default
    LoadBalancingStrategy strategy = LoadBalancingStrategy.LEAST_CONNECTIONS;

    // Token bucket capacity before the priority multiplier
    @Builder.Default
    int requestsPerMinute = 60;
    @Builder.Default
    Duration rateLimitWindow = Duration.ofMinutes(1);

    @Builder.Default
    int virtualNodes = 150;

    // Health rule
    @Builder.Default
    Duration heartbeatTimeout = Duration.ofSeconds(30);
    @Builder.Default
    double cpuThreshold = 90.0;
    @Builder.Default
    double memoryThreshold = 90.0;

    @Builder.Default
    Duration healthCheckInterval = Duration.ofSeconds(10);
    @Builder.Default
    Duration rateLimitResetInterval = Duration.ofSeconds(60);

    // Used for nodes whose instance metadata does not say otherwise
    @Builder.Default
    int defaultWeight = 1;
    @Builder.Default
    int defaultMaxConnections = 1000;

    public static BalancerConfig fromEnv() {
        return BalancerConfig.builder()
            .strategy(LoadBalancingStrategy.fromName(getEnv("LB_STRATEGY", "least_connections")))
            .requestsPerMinute(getInt("LB_REQUESTS_PER_MINUTE", 60))
            .virtualNodes(getInt("LB_VIRTUAL_NODES", 150))
            .heartbeatTimeout(getSeconds("LB_HEARTBEAT_TIMEOUT_SEC", 30))
            .cpuThreshold(getDouble("LB_CPU_THRESHOLD", 90.0))
            .memoryThreshold(getDouble("LB_MEMORY_THRESHOLD", 90.0))
            .healthCheckInterval(getSeconds("LB_HEALTH_CHECK_INTERVAL_SEC", 10))
            .rateLimitResetInterval(getSeconds("LB_RATE_LIMIT_RESET_INTERVAL_SEC", 60))
            .defaultWeight(getInt("LB_DEFAULT_WEIGHT", 1))
            .defaultMaxConnections(getInt("LB_DEFAULT_MAX_CONNECTIONS", 1000))
            .build();
    }

    public void validate() {
        if (strategy == null) {
            throw new ConfigurationException("Load balancing strategy must be set");
        }
        if (requestsPerMinute < 0) {
            throw new ConfigurationException("requestsPerMinute must not be negative, got " + requestsPerMinute);
        }
        if (virtualNodes <= 0) {
            throw new ConfigurationException("virtualNodes must be positive, got " + virtualNodes);
        }
        if (defaultWeight < 1 || defaultMaxConnections < 1) {
            throw new ConfigurationException("Default node weight and max connections must be at least 1");
        }
        EnvSupport.requirePositive("rateLimitWindow", rateLimitWindow);
        EnvSupport.requirePositive("heartbeatTimeout", heartbeatTimeout);
        EnvSupport.requirePositive("healthCheckInterval", healthCheckInterval);
        EnvSupport.requirePositive("rateLimitResetInterval", rateLimitResetInterval);
    }
}
