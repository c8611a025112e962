package com.qqsuccubus.delivery.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the application event type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for failure reason.
     */
    public static final String REASON = "reason";
}
