package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.Node;

import java.util.List;

/**
 * Picks a node for a client from the current healthy set.
 * <p>
 * Called with the load balancer's lock held, so implementations may keep plain
 * mutable state and must not block.
 * </p>
 */
public interface NodeSelector {

    /**
     * @param healthyNodes non-empty list of healthy nodes
     * @return the chosen node, never null for a non-empty list
     */
    Node select(String clientId, List<Node> healthyNodes);

    /**
     * Called whenever the healthy set changes.
     */
    default void rebuild(List<Node> healthyNodes) {
    }
}
