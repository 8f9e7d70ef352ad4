package com.streamfleet.controlplane.balancer;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Point-in-time summary of the load balancer.
 */
@Value
@Builder
public class BalancerStats {
    LoadBalancingStrategy strategy;
    int totalNodes;
    int healthyNodes;
    List<NodeRef> nodes;
    int totalClients;
    long totalRequests;
    long routedRequests;
    long rateLimitedRequests;
    long rejectedRequests;
    Duration uptime;
}
