package com.streamfleet.controlplane.scale;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record of one executed scale action.
 */
@Value
@Builder
public class ScalingEvent {
    public static final String TRIGGER_AUTO = "auto_scaling";
    public static final String TRIGGER_MANUAL = "manual";

    Instant timestamp;
    ScalingAction action;
    String trigger;
    String reason;
    int oldCount;
    int newCount;
    boolean success;
    String error;
}
