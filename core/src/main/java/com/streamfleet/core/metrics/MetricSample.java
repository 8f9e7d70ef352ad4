package com.streamfleet.core.metrics;

import lombok.Value;

import java.time.Instant;

/**
 * One observation of a named metric.
 */
@Value
public class MetricSample {
    Instant timestamp;
    double value;
    String source;
}
