package com.streamfleet.controlplane.scale;

/**
 * What a scaling rule watches.
 * <p>
 * {@link #CONNECTION_COUNT} rules use the live connections-per-healthy-instance value;
 * all others use the rolling average of their metric.
 * </p>
 */
public enum ScalingTrigger {
    CPU_USAGE,
    MEMORY_USAGE,
    CONNECTION_COUNT,
    RESPONSE_TIME,
    QUEUE_LENGTH,
    CUSTOM_METRIC
}
