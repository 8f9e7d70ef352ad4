package com.streamfleet.controlplane.balancer;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-client routing and rate-limit state, created on first contact.
 * Guarded by the owning {@link LoadBalancer}'s lock.
 */
@Getter
public class ClientInfo {
    private final String clientId;
    private ClientPriority priority = ClientPriority.MEDIUM;
    private int connectionCount;
    private Instant lastActivity;
    private int rateLimitTokens;
    private Instant rateLimitReset;
    private String assignedNode;

    ClientInfo(String clientId, Instant now) {
        this.clientId = clientId;
        this.lastActivity = now;
        // Bucket starts empty and is filled on the first request
        this.rateLimitReset = now;
    }

    void setPriority(ClientPriority priority) {
        this.priority = priority;
    }

    /**
     * Refills the bucket if its window has ended.
     *
     * @return true if a refill happened
     */
    boolean refillIfDue(Instant now, int requestsPerMinute, Duration window) {
        if (now.isBefore(rateLimitReset)) {
            return false;
        }
        rateLimitTokens = priority.tokenCapacity(requestsPerMinute);
        rateLimitReset = now.plus(window);
        return true;
    }

    boolean tryConsumeToken() {
        if (rateLimitTokens <= 0) {
            return false;
        }
        rateLimitTokens--;
        return true;
    }

    void assign(String nodeId, Instant now) {
        assignedNode = nodeId;
        connectionCount++;
        lastActivity = now;
    }

    void release(Instant now) {
        connectionCount = Math.max(0, connectionCount - 1);
        lastActivity = now;
        if (connectionCount == 0) {
            assignedNode = null;
        }
    }

    ClientSnapshot snapshot() {
        return ClientSnapshot.builder()
            .clientId(clientId)
            .priority(priority)
            .connectionCount(connectionCount)
            .lastActivity(lastActivity)
            .rateLimitTokens(rateLimitTokens)
            .rateLimitReset(rateLimitReset)
            .assignedNode(assignedNode)
            .build();
    }
}
