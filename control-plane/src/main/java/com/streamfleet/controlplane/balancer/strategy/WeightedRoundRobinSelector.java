package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Round robin over a virtual rotation in which each node appears {@code weight} times.
 */
public class WeightedRoundRobinSelector implements NodeSelector {
    private List<Node> rotation = new ArrayList<>();
    private long index;

    @Override
    public Node select(String clientId, List<Node> healthyNodes) {
        if (rotation.isEmpty()) {
            rebuild(healthyNodes);
        }
        if (rotation.isEmpty()) {
            return healthyNodes.get(0);
        }

        Node node = rotation.get((int) (index % rotation.size()));
        index++;
        return node;
    }

    @Override
    public void rebuild(List<Node> healthyNodes) {
        List<Node> expanded = new ArrayList<>();
        for (Node node : healthyNodes) {
            for (int i = 0; i < node.getWeight(); i++) {
                expanded.add(node);
            }
        }
        rotation = expanded;
        index = 0;
    }
}
