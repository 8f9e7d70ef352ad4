package com.streamfleet.controlplane.balancer.strategy;

import com.streamfleet.controlplane.balancer.LoadBalancingStrategy;

public final class NodeSelectors {
    private NodeSelectors() {
    }

    public static NodeSelector forStrategy(LoadBalancingStrategy strategy, int virtualNodes) {
        switch (strategy) {
            case ROUND_ROBIN:
                return new RoundRobinSelector();
            case WEIGHTED_ROUND_ROBIN:
                return new WeightedRoundRobinSelector();
            case CONSISTENT_HASH:
                return new ConsistentHashSelector(virtualNodes);
            case RESOURCE_BASED:
                return new ResourceBasedSelector();
            case LEAST_CONNECTIONS:
            default:
                return new LeastConnectionsSelector();
        }
    }
}
