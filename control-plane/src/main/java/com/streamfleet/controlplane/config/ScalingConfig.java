package com.streamfleet.controlplane.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

import static com.streamfleet.controlplane.config.EnvSupport.getDouble;
import static com.streamfleet.controlplane.config.EnvSupport.getInt;
import static com.streamfleet.controlplane.config.EnvSupport.getSeconds;

/**
 * Autoscaling bounds, targets and timings.
 */
@Value
@Builder(toBuilder = true)
public class ScalingConfig {

    @Builder.Default
    int minInstances = 1;
    @Builder.Default
    int maxInstances = 10;

    // Targets for the default rules
    @Builder.Default
    double targetCpuUtilization = 70.0;
    @Builder.Default
    double targetMemoryUtilization = 80.0;
    @Builder.Default
    int targetConnectionsPerInstance = 800;

    @Builder.Default
    Duration scaleUpCooldown = Duration.ofSeconds(300);
    @Builder.Default
    Duration scaleDownCooldown = Duration.ofSeconds(600);

    @Builder.Default
    Duration evaluationInterval = Duration.ofSeconds(60);
    @Builder.Default
    Duration metricsWindow = Duration.ofSeconds(300);
    @Builder.Default
    Duration metricsSampleInterval = Duration.ofSeconds(30);

    // Size of the in-memory event log
    @Builder.Default
    int maxEvents = 100;

    public static ScalingConfig fromEnv() {
        return ScalingConfig.builder()
            .minInstances(getInt("SCALING_MIN_INSTANCES", 1))
            .maxInstances(getInt("SCALING_MAX_INSTANCES", 10))
            .targetCpuUtilization(getDouble("SCALING_TARGET_CPU", 70.0))
            .targetMemoryUtilization(getDouble("SCALING_TARGET_MEMORY", 80.0))
            .targetConnectionsPerInstance(getInt("SCALING_TARGET_CONNECTIONS", 800))
            .scaleUpCooldown(getSeconds("SCALING_UP_COOLDOWN_SEC", 300))
            .scaleDownCooldown(getSeconds("SCALING_DOWN_COOLDOWN_SEC", 600))
            .evaluationInterval(getSeconds("SCALING_EVALUATION_INTERVAL_SEC", 60))
            .metricsWindow(getSeconds("SCALING_METRICS_WINDOW_SEC", 300))
            .metricsSampleInterval(getSeconds("SCALING_SAMPLE_INTERVAL_SEC", 30))
            .maxEvents(getInt("SCALING_MAX_EVENTS", 100))
            .build();
    }

    public void validate() {
        if (minInstances < 1) {
            throw new ConfigurationException("minInstances must be at least 1, got " + minInstances);
        }
        if (minInstances > maxInstances) {
            throw new ConfigurationException(
                "minInstances (" + minInstances + ") must not exceed maxInstances (" + maxInstances + ")");
        }
        if (targetCpuUtilization <= 0 || targetMemoryUtilization <= 0 || targetConnectionsPerInstance <= 0) {
            throw new ConfigurationException("Scaling targets must be positive");
        }
        if (maxEvents < 1) {
            throw new ConfigurationException("maxEvents must be at least 1, got " + maxEvents);
        }
        EnvSupport.requireNonNegative("scaleUpCooldown", scaleUpCooldown);
        EnvSupport.requireNonNegative("scaleDownCooldown", scaleDownCooldown);
        EnvSupport.requirePositive("evaluationInterval", evaluationInterval);
        EnvSupport.requirePositive("metricsWindow", metricsWindow);
        EnvSupport.requirePositive("metricsSampleInterval", metricsSampleInterval);
    }
}
