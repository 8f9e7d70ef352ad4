package com.streamfleet.controlplane.balancer;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * The load balancer's live view of one backend server.
 * <p>
 * Mutable; every read and write happens under the owning {@link LoadBalancer}'s lock.
 * Callers get {@link NodeRef} snapshots instead.
 * </p>
 */
@Getter
public class Node {
    private final String nodeId;
    private final String host;
    private final int port;
    private final int weight;
    private final int maxConnections;
    private final String region;
    private final String zone;

    private int currentConnections;
    private double cpuUsage;
    private double memoryUsage;
    private Instant lastHeartbeat;
    private boolean healthy;

    @Builder
    private Node(String host, int port, Integer weight, Integer maxConnections, String region, String zone) {
        this.nodeId = nodeIdFor(host, port);
        this.host = host;
        this.port = port;
        this.weight = weight != null ? weight : 1;
        this.maxConnections = maxConnections != null ? maxConnections : 1000;
        this.region = region;
        this.zone = zone;
        this.healthy = true;
    }

    public static String nodeIdFor(String host, int port) {
        return host + ":" + port;
    }

    boolean isAtCapacity() {
        return currentConnections >= maxConnections;
    }

    void updateTelemetry(int connections, double cpu, double memory, Instant heartbeat) {
        this.currentConnections = Math.max(0, Math.min(maxConnections, connections));
        this.cpuUsage = cpu;
        this.memoryUsage = memory;
        this.lastHeartbeat = heartbeat;
    }

    void touch(Instant heartbeat) {
        this.lastHeartbeat = heartbeat;
    }

    void acquireConnection() {
        if (currentConnections < maxConnections) {
            currentConnections++;
        }
    }

    void releaseConnection() {
        currentConnections = Math.max(0, currentConnections - 1);
    }

    void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    NodeRef snapshot() {
        return NodeRef.builder()
            .nodeId(nodeId)
            .host(host)
            .port(port)
            .weight(weight)
            .maxConnections(maxConnections)
            .currentConnections(currentConnections)
            .cpuUsage(cpuUsage)
            .memoryUsage(memoryUsage)
            .lastHeartbeat(lastHeartbeat)
            .healthy(healthy)
            .region(region)
            .zone(zone)
            .build();
    }
}
