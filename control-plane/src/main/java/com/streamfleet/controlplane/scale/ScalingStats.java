package com.streamfleet.controlplane.scale;

import com.streamfleet.controlplane.config.ScalingConfig;
import com.streamfleet.core.metrics.MetricSample;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ScalingStats {
    ScalingConfig config;
    List<ScalingRule> rules;
    List<ScalingEvent> recentEvents;
    int totalEvents;
    Instant lastScaleUp;
    Instant lastScaleDown;
    Map<String, List<MetricSample>> metrics;
}
