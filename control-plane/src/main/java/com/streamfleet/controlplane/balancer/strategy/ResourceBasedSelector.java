package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.Node;

import java.util.List;

/**
 * Picks the node with the lowest combined load score.
 * <p>
 * score = 0.4·cpu + 0.3·memory + 0.3·(connections / maxConnections · 100)
 * </p>
 */
public class ResourceBasedSelector implements NodeSelector {
    private static final double CPU_WEIGHT = 0.4;
    private static final double MEMORY_WEIGHT = 0.3;
    private static final double CONNECTION_WEIGHT = 0.3;

    @Override
    public Node select(String clientId, List<Node> healthyNodes) {
        Node best = null;
        double bestScore = Double.MAX_VALUE;

        for (Node node : healthyNodes) {
            double score = score(node);
            if (score < bestScore) {
                bestScore = score;
                best = node;
            }
        }
        return best;
    }

    static double score(Node node) {
        double connectionPct = node.getMaxConnections() > 0
            ? node.getCurrentConnections() * 100.0 / node.getMaxConnections()
            : 100.0;
        return CPU_WEIGHT * node.getCpuUsage()
            + MEMORY_WEIGHT * node.getMemoryUsage()
            + CONNECTION_WEIGHT * connectionPct;
    }
}
