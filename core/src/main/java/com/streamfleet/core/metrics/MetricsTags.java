package com.streamfleet.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the result of an operation.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for a scaling action.
     */
    public static final String ACTION = "action";
}
