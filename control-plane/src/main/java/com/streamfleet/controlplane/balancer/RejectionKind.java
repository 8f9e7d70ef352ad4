package com.streamfleet.controlplane.balancer;

/**
 * Why a routing request got no node.
 */
public enum RejectionKind {
    /** The client's token bucket is empty. */
    RATE_LIMITED,
    /** No node passes the health rule. */
    NO_HEALTHY_NODE,
    /** Healthy nodes exist but all are at their connection limit. */
    NO_CAPACITY
}
