package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.Node;

import java.util.List;

/**
 * Picks the node with the fewest current connections; ties go to the earliest node.
 */
public class LeastConnectionsSelector implements NodeSelector {

    @Override
    public Node select(String clientId, List<Node> healthyNodes) {
        Node best = null;
        for (Node node : healthyNodes) {
            if (best == null || node.getCurrentConnections() < best.getCurrentConnections()) {
                best = node;
            }
        }
        return best;
    }
}
