package com.rebalancer.metrics.registry;

/**
 * Well-known metric keys registered by {@link MetricsRegistrar}.
 *
 * <p>The key doubles as the Prometheus collector name. The text format
 * exposes counter families with the client's {@code _total} suffix, e.g.
 * {@code # TYPE request_count_total counter}.
 */
public final class MetricNames {

    /** Requests handled, partitioned by request type ({@code req}). */
    public static final String REQUEST_COUNT = "request_count";

    /** Objects processed, partitioned by object type ({@code type}). */
    public static final String OBJECT_COUNT = "object_count";

    /** Errors encountered, partitioned by error kind ({@code error}). */
    public static final String ERROR_COUNT = "error_count";

    /** Bytes transferred. */
    public static final String BYTES_COUNT = "bytes_count";

    /** Assignment completion time in seconds. */
    public static final String ASSIGNMENT_TIME = "assignment_time";

    /** Bucket of every counter vector that is incremented on each update. */
    public static final String TOTAL_BUCKET = "total";

    private MetricNames() {
        throw new AssertionError("No instances");
    }
}
