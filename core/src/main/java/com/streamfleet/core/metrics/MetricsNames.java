package com.streamfleet.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code fleet.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Routing requests handled by the load balancer.
     * <p>
     * Tags: outcome (routed/rate_limited/no_healthy_node/no_capacity)
     * </p>
     */
    public static final String LB_REQUESTS_TOTAL = "fleet.lb.requests.total";

    /**
     * Gauge: Nodes known to the load balancer.
     */
    public static final String LB_NODES = "fleet.lb.nodes";

    /**
     * Gauge: Nodes currently passing the health rule.
     */
    public static final String LB_HEALTHY_NODES = "fleet.lb.nodes.healthy";

    /**
     * Gauge: Clients tracked by the load balancer.
     */
    public static final String LB_CLIENTS = "fleet.lb.clients";

    /**
     * Gauge: Instances in the discovery cache.
     */
    public static final String REGISTRY_DISCOVERED = "fleet.registry.discovered";

    /**
     * Counter: Discovery queries that fell back to the cached snapshot.
     */
    public static final String REGISTRY_DISCOVERY_FAILURES_TOTAL = "fleet.registry.discovery.failures.total";

    /**
     * Counter: Scaling decisions made.
     * <p>
     * Tags: action (scale_up/scale_down/no_action)
     * </p>
     */
    public static final String SCALING_DECISIONS_TOTAL = "fleet.scaling.decisions.total";

    /**
     * Counter: Scale actions executed.
     * <p>
     * Tags: action (scale_up/scale_down), outcome (success/failure)
     * </p>
     */
    public static final String SCALING_ACTIONS_TOTAL = "fleet.scaling.actions.total";
}
