package com.streamfleet.controlplane.balancer;

import java.util.List;
import java.util.Optional;

/**
 * Interface for client routing (Dependency Inversion Principle).
 * <p>
 * Abstracts node tracking and node selection so callers such as the scaling
 * manager and the HTTP surface do not depend on the concrete balancer.
 * </p>
 */
public interface ILoadBalancer {

    void addNode(Node node);

    void removeNode(String nodeId);

    boolean updateNodeStats(String nodeId, int connections, double cpuUsage, double memoryUsage);

    /**
     * Routes a client to a node. Never blocks and never throws for lack of capacity.
     */
    RoutingResult getNodeForClient(String clientId);

    void releaseClient(String clientId);

    void setClientPriority(String clientId, ClientPriority priority);

    Optional<ClientSnapshot> getClientStats(String clientId);

    BalancerStats getStats();

    /**
     * Snapshots of all known nodes.
     */
    List<NodeRef> getNodes();

    /**
     * Snapshots of the nodes currently passing the health rule.
     */
    List<NodeRef> getHealthyNodes();
}
