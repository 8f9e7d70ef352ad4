package com.streamfleet.controlplane.balancer;

import com.streamfleet.controlplane.balancer.strategy.NodeSelector;
import com.streamfleet.controlplane.balancer.strategy.NodeSelectors;
import com.streamfleet.controlplane.config.BalancerConfig;
import com.streamfleet.core.metrics.MetricsNames;
import com.streamfleet.core.metrics.MetricsTags;
import com.streamfleet.core.util.BackgroundLoop;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Routes clients to healthy backend nodes.
 * <p>
 * <b>Routing path</b> ({@link #getNodeForClient(String)}):
 * <ol>
 *   <li>count the request;</li>
 *   <li>take a token from the client's bucket, else reject as RATE_LIMITED;</li>
 *   <li>reject as NO_HEALTHY_NODE if no node passes the health rule;</li>
 *   <li>let the configured strategy pick a node;</li>
 *   <li>if the pick is full, fall back once to the least-connected healthy node with room, else NO_CAPACITY;</li>
 *   <li>record the assignment and return a snapshot of the node.</li>
 * </ol>
 * </p>
 * <p>
 * <b>Health rule:</b> a node is healthy iff its last heartbeat is younger than the timeout,
 * cpu and memory are below their thresholds, and it is not at its connection limit.
 * Health is recomputed on every telemetry update and by a periodic loop.
 * </p>
 * <p>
 * <b>Thread-safety:</b> nodes, clients and the strategy's state (hash ring, rotation index)
 * are guarded by one lock. Nothing under the lock performs I/O, so the routing path never blocks.
 * </p>
 */
public class LoadBalancer implements ILoadBalancer {
    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final BalancerConfig config;
    private final Clock clock;
    private final Instant startedAt;
    private final NodeSelector selector;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, ClientInfo> clients = new LinkedHashMap<>();
    private List<Node> healthyNodes = new ArrayList<>();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong routedRequests = new AtomicLong();
    private final AtomicLong rateLimitedRequests = new AtomicLong();
    private final AtomicLong rejectedRequests = new AtomicLong();

    private final Counter routedCounter;
    private final Counter rateLimitedCounter;
    private final Counter noHealthyNodeCounter;
    private final Counter noCapacityCounter;

    private final BackgroundLoop healthLoop;
    private final BackgroundLoop rateLimitLoop;

    public LoadBalancer(BalancerConfig config, MeterRegistry meterRegistry, Clock clock) {
        config.validate();
        this.config = config;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.selector = NodeSelectors.forStrategy(config.getStrategy(), config.getVirtualNodes());

        this.routedCounter = requestCounter(meterRegistry, "routed");
        this.rateLimitedCounter = requestCounter(meterRegistry, "rate_limited");
        this.noHealthyNodeCounter = requestCounter(meterRegistry, "no_healthy_node");
        this.noCapacityCounter = requestCounter(meterRegistry, "no_capacity");

        Gauge.builder(MetricsNames.LB_NODES, this, lb -> lb.getNodeCount())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.LB_HEALTHY_NODES, this, lb -> lb.getHealthyNodeCount())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.LB_CLIENTS, this, lb -> lb.getClientCount())
            .register(meterRegistry);

        this.healthLoop = new BackgroundLoop("lb-health", config.getHealthCheckInterval(),
            () -> Mono.fromRunnable(this::revalidateHealth));
        this.rateLimitLoop = new BackgroundLoop("lb-rate-limit", config.getRateLimitResetInterval(),
            () -> Mono.fromRunnable(this::refillExpiredBuckets));

        log.info("Load balancer initialized: strategy={}, rpm={}, vnodes={}",
            config.getStrategy(), config.getRequestsPerMinute(), config.getVirtualNodes());
    }

    private static Counter requestCounter(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder(MetricsNames.LB_REQUESTS_TOTAL)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(meterRegistry);
    }

    public void start() {
        healthLoop.start();
        rateLimitLoop.start();
        log.info("Load balancer started");
    }

    public void stop() {
        healthLoop.stop();
        rateLimitLoop.stop();
        log.info("Load balancer stopped");
    }

    /**
     * Adds a node, or replaces the node with the same id.
     */
    @Override
    public void addNode(Node node) {
        lock.lock();
        try {
            if (node.getLastHeartbeat() == null) {
                node.touch(clock.instant());
            }
            node.setHealthy(isHealthy(node, clock.instant()));
            nodes.put(node.getNodeId(), node);
            refreshHealthyNodes();
        } finally {
            lock.unlock();
        }
        log.info("Added node {} (weight={}, maxConnections={})",
            node.getNodeId(), node.getWeight(), node.getMaxConnections());
    }

    @Override
    public void removeNode(String nodeId) {
        boolean removed;
        lock.lock();
        try {
            removed = nodes.remove(nodeId) != null;
            if (removed) {
                refreshHealthyNodes();
            }
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.info("Removed node {}", nodeId);
        }
    }

    /**
     * Applies a telemetry report; also counts as a heartbeat.
     *
     * @return false if the node is unknown
     */
    @Override
    public boolean updateNodeStats(String nodeId, int connections, double cpuUsage, double memoryUsage) {
        lock.lock();
        try {
            Node node = nodes.get(nodeId);
            if (node == null) {
                log.debug("Ignoring stats for unknown node {}", nodeId);
                return false;
            }

            Instant now = clock.instant();
            node.updateTelemetry(connections, cpuUsage, memoryUsage, now);

            boolean healthy = isHealthy(node, now);
            if (healthy != node.isHealthy()) {
                node.setHealthy(healthy);
                log.info("Node {} is now {}", nodeId, healthy ? "healthy" : "unhealthy");
                refreshHealthyNodes();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RoutingResult getNodeForClient(String clientId) {
        totalRequests.incrementAndGet();

        lock.lock();
        try {
            Instant now = clock.instant();
            ClientInfo client = clients.computeIfAbsent(clientId, id -> new ClientInfo(id, now));

            client.refillIfDue(now, config.getRequestsPerMinute(), config.getRateLimitWindow());
            if (!client.tryConsumeToken()) {
                rateLimitedRequests.incrementAndGet();
                rateLimitedCounter.increment();
                log.debug("Client {} is rate limited", clientId);
                return RoutingResult.rejected(RejectionKind.RATE_LIMITED);
            }

            if (healthyNodes.isEmpty()) {
                log.warn("No healthy nodes available for client {}", clientId);
                return reject(noHealthyNodeCounter, RejectionKind.NO_HEALTHY_NODE);
            }

            Node node = selector.select(clientId, healthyNodes);
            if (node == null || node.isAtCapacity()) {
                String full = node != null ? node.getNodeId() : null;
                log.warn("Node {} is at capacity, trying an alternative", full);
                node = leastConnectedWithRoom(full);
                if (node == null) {
                    return reject(noCapacityCounter, RejectionKind.NO_CAPACITY);
                }
            }

            node.acquireConnection();
            client.assign(node.getNodeId(), now);

            routedRequests.incrementAndGet();
            routedCounter.increment();
            log.debug("Assigned client {} to node {}", clientId, node.getNodeId());
            return RoutingResult.routed(node.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases one connection of the client; the assignment is cleared once the client
     * has no connections left so its next request is routed afresh.
     */
    @Override
    public void releaseClient(String clientId) {
        lock.lock();
        try {
            ClientInfo client = clients.get(clientId);
            if (client == null) {
                return;
            }

            String assigned = client.getAssignedNode();
            if (assigned != null) {
                Node node = nodes.get(assigned);
                if (node != null) {
                    node.releaseConnection();
                }
            }
            client.release(clock.instant());
        } finally {
            lock.unlock();
        }
        log.debug("Released client {}", clientId);
    }

    @Override
    public void setClientPriority(String clientId, ClientPriority priority) {
        lock.lock();
        try {
            clients.computeIfAbsent(clientId, id -> new ClientInfo(id, clock.instant()))
                .setPriority(priority);
        } finally {
            lock.unlock();
        }
        log.info("Set client {} priority to {}", clientId, priority);
    }

    @Override
    public Optional<ClientSnapshot> getClientStats(String clientId) {
        lock.lock();
        try {
            ClientInfo client = clients.get(clientId);
            return client != null ? Optional.of(client.snapshot()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BalancerStats getStats() {
        lock.lock();
        try {
            return BalancerStats.builder()
                .strategy(config.getStrategy())
                .totalNodes(nodes.size())
                .healthyNodes(healthyNodes.size())
                .nodes(getNodesLocked())
                .totalClients(clients.size())
                .totalRequests(totalRequests.get())
                .routedRequests(routedRequests.get())
                .rateLimitedRequests(rateLimitedRequests.get())
                .rejectedRequests(rejectedRequests.get())
                .uptime(Duration.between(startedAt, clock.instant()))
                .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<NodeRef> getNodes() {
        lock.lock();
        try {
            return getNodesLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<NodeRef> getHealthyNodes() {
        lock.lock();
        try {
            return healthyNodes.stream().map(Node::snapshot).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public LoadBalancingStrategy getStrategy() {
        return config.getStrategy();
    }

    /**
     * Re-evaluates every node's health (heartbeats age without telemetry updates).
     */
    void revalidateHealth() {
        lock.lock();
        try {
            Instant now = clock.instant();
            boolean changed = false;
            for (Node node : nodes.values()) {
                boolean healthy = isHealthy(node, now);
                if (healthy != node.isHealthy()) {
                    node.setHealthy(healthy);
                    changed = true;
                    log.info("Node {} is now {}", node.getNodeId(), healthy ? "healthy" : "unhealthy");
                }
            }
            if (changed) {
                refreshHealthyNodes();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refills every bucket whose window has ended.
     */
    void refillExpiredBuckets() {
        int refilled = 0;
        lock.lock();
        try {
            Instant now = clock.instant();
            for (ClientInfo client : clients.values()) {
                if (client.refillIfDue(now, config.getRequestsPerMinute(), config.getRateLimitWindow())) {
                    refilled++;
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug("Refilled {} rate limit buckets", refilled);
    }

    private RoutingResult reject(Counter counter, RejectionKind kind) {
        rejectedRequests.incrementAndGet();
        counter.increment();
        return RoutingResult.rejected(kind);
    }

    private Node leastConnectedWithRoom(String excludedNodeId) {
        Node best = null;
        for (Node node : healthyNodes) {
            if (node.getNodeId().equals(excludedNodeId) || node.isAtCapacity()) {
                continue;
            }
            if (best == null || node.getCurrentConnections() < best.getCurrentConnections()) {
                best = node;
            }
        }
        return best;
    }

    private boolean isHealthy(Node node, Instant now) {
        if (node.getLastHeartbeat() == null
            || Duration.between(node.getLastHeartbeat(), now).compareTo(config.getHeartbeatTimeout()) >= 0) {
            return false;
        }
        if (node.getCpuUsage() >= config.getCpuThreshold() || node.getMemoryUsage() >= config.getMemoryThreshold()) {
            return false;
        }
        return !node.isAtCapacity();
    }

    private void refreshHealthyNodes() {
        List<Node> healthy = nodes.values().stream()
            .filter(Node::isHealthy)
            .collect(Collectors.toList());

        boolean membershipChanged = !healthy.equals(healthyNodes);
        healthyNodes = healthy;
        if (membershipChanged) {
            selector.rebuild(healthy);
        }
        log.debug("Healthy nodes: {}/{}", healthy.size(), nodes.size());
    }

    private List<NodeRef> getNodesLocked() {
        return nodes.values().stream().map(Node::snapshot).collect(Collectors.toList());
    }

    private int getNodeCount() {
        lock.lock();
        try {
            return nodes.size();
        } finally {
            lock.unlock();
        }
    }

    private int getHealthyNodeCount() {
        lock.lock();
        try {
            return healthyNodes.size();
        } finally {
            lock.unlock();
        }
    }

    private int getClientCount() {
        lock.lock();
        try {
            return clients.size();
        } finally {
            lock.unlock();
        }
    }
}
