package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.Node;
import com.streamfleet.core.hash.ConsistentHashRing;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps a client id to a node through a consistent hash ring over the healthy nodes.
 * <p>
 * The ring is rebuilt only when the healthy set changes, so the same client keeps
 * landing on the same node while membership is stable.
 * </p>
 */
public class ConsistentHashSelector implements NodeSelector {
    private final int virtualNodes;
    private ConsistentHashRing ring = ConsistentHashRing.empty();

    public ConsistentHashSelector(int virtualNodes) {
        this.virtualNodes = virtualNodes;
    }

    @Override
    public Node select(String clientId, List<Node> healthyNodes) {
        String nodeId = ring.successor(clientId);
        if (nodeId != null) {
            for (Node node : healthyNodes) {
                if (node.getNodeId().equals(nodeId)) {
                    return node;
                }
            }
        }
        // Ring not built yet or out of date
        return healthyNodes.get(0);
    }

    @Override
    public void rebuild(List<Node> healthyNodes) {
        ring = ConsistentHashRing.fromNodes(
            healthyNodes.stream().map(Node::getNodeId).collect(Collectors.toList()),
            virtualNodes
        );
    }

    public ConsistentHashRing getRing() {
        return ring;
    }
}
