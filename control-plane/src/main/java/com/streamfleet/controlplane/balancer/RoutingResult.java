package com.streamfleet.controlplane.balancer;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of {@link LoadBalancer#getNodeForClient(String)}: either a node or a rejection.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutingResult {
    NodeRef node;
    RejectionKind rejection;

    public static RoutingResult routed(NodeRef node) {
        return new RoutingResult(node, null);
    }

    public static RoutingResult rejected(RejectionKind kind) {
        return new RoutingResult(null, kind);
    }

    public boolean isRouted() {
        return node != null;
    }
}
