package com.streamfleet.controlplane.balancer;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ClientSnapshot {
    String clientId;
    ClientPriority priority;
    int connectionCount;
    Instant lastActivity;
    int rateLimitTokens;
    Instant rateLimitReset;
    String assignedNode;
}
