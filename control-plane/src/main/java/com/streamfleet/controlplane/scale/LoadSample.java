package com.streamfleet.controlplane.scale;

import lombok.Value;

/**
 * Fleet-wide load averaged over the healthy instances.
 */
@Value
class LoadSample {
    double cpuUsage;
    double memoryUsage;
    double connectionsPerInstance;
}
