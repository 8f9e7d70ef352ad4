package com.streamfleet.controlplane.balancer;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of a {@link Node}, safe to hand out of the balancer.
 */
@Value
@Builder
public class NodeRef {
    String nodeId;
    String host;
    int port;
    int weight;
    int maxConnections;
    int currentConnections;
    double cpuUsage;
    double memoryUsage;
    Instant lastHeartbeat;
    boolean healthy;
    String region;
    String zone;
}
