package com.rebalancer.metrics.registry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The process's well-known metrics, keyed by {@link MetricNames}.
 *
 * <p>Built once by {@link MetricsRegistrar} and immutable afterwards: the
 * set of keys and the kind behind each key never change. Every update
 * method may be called concurrently from any number of threads without
 * external locking.
 *
 * <h3>Misuse Policy</h3>
 * <p>A metrics mistake must never change the behavior of the monitored
 * service. An update with an unknown key, with a key of another kind, or
 * with a negative amount is ignored and logged once at SEVERE as
 * {@code Invalid metric: <key>}; nothing is thrown to the caller.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistrar.register(config);
 *
 * metrics.counterVecInc(MetricNames.REQUEST_COUNT, "GET");
 * metrics.counterIncBy(MetricNames.BYTES_COUNT, object.size());
 * metrics.histogramObserve(MetricNames.ASSIGNMENT_TIME, Duration.ofMillis(1500));
 * }</pre>
 */
public final class MetricsRegistry {

    private static final Logger logger = Logger.getLogger(MetricsRegistry.class.getName());

    private final Map<String, Metric> metrics;

    /**
     * Creates a registry over the given metrics. The map is copied.
     *
     * @param metrics metrics by key
     */
    public MetricsRegistry(Map<String, Metric> metrics) {
        this.metrics = Map.copyOf(metrics);
    }

    // ========================================================================
    // GAUGES
    // ========================================================================

    /**
     * Increments a gauge by one.
     */
    public void gaugeInc(String key) {
        Metric metric = lookup(key, Metric.Kind.GAUGE);
        if (metric != null) {
            metric.incrementGauge(1.0);
        }
    }

    /**
     * Decrements a gauge by one.
     */
    public void gaugeDec(String key) {
        Metric metric = lookup(key, Metric.Kind.GAUGE);
        if (metric != null) {
            metric.incrementGauge(-1.0);
        }
    }

    /**
     * Sets a gauge to an absolute value. The last write wins.
     *
     * @param value non-negative value
     */
    public void gaugeSet(String key, long value) {
        Metric metric = lookup(key, Metric.Kind.GAUGE);
        if (metric != null && checkNonNegative(key, value)) {
            metric.setGauge(value);
        }
    }

    // ========================================================================
    // COUNTERS
    // ========================================================================

    /**
     * Adds {@code value} to a plain counter.
     *
     * @param value non-negative delta
     */
    public void counterIncBy(String key, long value) {
        Metric metric = lookup(key, Metric.Kind.COUNTER);
        if (metric != null && checkNonNegative(key, value)) {
            metric.incrementCounter(value);
        }
    }

    /**
     * Increments the {@code total} bucket of a counter vector by one, and
     * {@code bucket} as well when it is not {@code null}.
     */
    public void counterVecInc(String key, String bucket) {
        counterVecIncBy(key, bucket, 1);
    }

    /**
     * Adds {@code value} to the {@code total} bucket of a counter vector, and
     * to {@code bucket} as well when it is not {@code null}. The bucket is
     * created on first use and kept for the lifetime of the process.
     *
     * <p>Keep the set of bucket names small and known in advance; every
     * distinct name becomes its own time series. {@code "total"} is reserved
     * for the aggregate: passing it is logged at SEVERE and changes nothing.
     *
     * @param bucket subset of the total to attribute the delta to, or {@code null}
     * @param value  non-negative delta
     */
    public void counterVecIncBy(String key, String bucket, long value) {
        Metric metric = lookup(key, Metric.Kind.COUNTER_VEC);
        if (metric == null) {
            return;
        }
        if (MetricNames.TOTAL_BUCKET.equals(bucket)) {
            logger.severe("Invalid metric: " + key + " (reserved bucket " + bucket + ")");
            return;
        }
        if (checkNonNegative(key, value)) {
            metric.incrementBuckets(bucket, value);
        }
    }

    // ========================================================================
    // HISTOGRAMS
    // ========================================================================

    /**
     * Records one observation in a histogram.
     */
    public void histogramObserve(String key, double value) {
        Metric metric = lookup(key, Metric.Kind.HISTOGRAM);
        if (metric != null) {
            metric.observe(value);
        }
    }

    /**
     * Records an elapsed time, in seconds, in a histogram.
     */
    public void histogramObserve(String key, Duration elapsed) {
        if (elapsed == null || elapsed.isNegative()) {
            logger.severe("Invalid metric: " + key + " (elapsed time " + elapsed + ")");
            return;
        }
        histogramObserve(key, elapsed.toNanos() / 1_000_000_000.0);
    }

    // ========================================================================
    // LOOKUP
    // ========================================================================

    /**
     * The metric registered under {@code key}, if any.
     */
    public Optional<Metric> metric(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(metrics.get(key));
    }

    /**
     * Registered keys.
     */
    public Set<String> keys() {
        return metrics.keySet();
    }

    private Metric lookup(String key, Metric.Kind expected) {
        Metric metric = key == null ? null : metrics.get(key);
        if (metric == null) {
            logger.severe("Invalid metric: " + key);
            return null;
        }
        if (metric.kind() != expected) {
            logger.severe("Invalid metric: " + key + " (is a " + metric.kind() + ", not a " + expected + ")");
            return null;
        }
        return metric;
    }

    private static boolean checkNonNegative(String key, long value) {
        if (value < 0) {
            logger.severe("Invalid metric: " + key + " (negative value " + value + ")");
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "MetricsRegistry{keys=" + metrics.keySet() + "}";
    }
}
