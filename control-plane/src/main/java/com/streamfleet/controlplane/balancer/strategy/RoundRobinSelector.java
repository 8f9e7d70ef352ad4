package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.Node;

import java.util.List;

/**
 * Cycles through the healthy nodes in order.
 */
public class RoundRobinSelector implements NodeSelector {
    private int index;

    @Override
    public Node select(String clientId, List<Node> healthyNodes) {
        Node node = healthyNodes.get(index % healthyNodes.size());
        index = (index + 1) % healthyNodes.size();
        return node;
    }
}
