package com.streamfleet.controlplane.scale;

import com.streamfleet.controlplane.config.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * One vote in the scaling decision: up above {@code scaleUpThreshold},
 * down below {@code scaleDownThreshold}, otherwise no action.
 */
@Value
@Builder(toBuilder = true)
public class ScalingRule {
    String name;
    ScalingTrigger trigger;
    String metricName;
    double scaleUpThreshold;
    double scaleDownThreshold;
    @Builder.Default
    int scaleUpAdjustment = 1;
    @Builder.Default
    int scaleDownAdjustment = 1;
    // Reported with the rule; actions are gated by the per-direction cooldowns
    @Builder.Default
    Duration cooldownPeriod = Duration.ofSeconds(300);
    @Builder.Default
    boolean enabled = true;

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Scaling rule name must not be blank");
        }
        if (trigger == null || metricName == null || metricName.isBlank()) {
            throw new ConfigurationException("Scaling rule " + name + " needs a trigger and a metric name");
        }
        if (scaleUpThreshold <= scaleDownThreshold) {
            throw new ConfigurationException("Scaling rule " + name + ": scale-up threshold (" + scaleUpThreshold
                + ") must be greater than scale-down threshold (" + scaleDownThreshold + ")");
        }
        if (scaleUpAdjustment < 1 || scaleDownAdjustment < 1) {
            throw new ConfigurationException("Scaling rule " + name + ": adjustments must be at least 1");
        }
        if (cooldownPeriod == null || cooldownPeriod.isNegative()) {
            throw new ConfigurationException("Scaling rule " + name + ": cooldown must not be negative");
        }
    }

    /**
     * Vote for an observed metric value.
     */
    public ScalingAction vote(double value) {
        if (value > scaleUpThreshold) {
            return ScalingAction.SCALE_UP;
        }
        if (value < scaleDownThreshold) {
            return ScalingAction.SCALE_DOWN;
        }
        return ScalingAction.NO_ACTION;
    }
}
