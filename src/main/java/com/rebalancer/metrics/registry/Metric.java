package com.rebalancer.metrics.registry;

import com.rebalancer.metrics.labels.ConstLabels;
import io.prometheus.client.Collector;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.util.List;
import java.util.Objects;

/**
 * A registered instrument: one of a closed set of kinds.
 *
 * <p>Each variant wraps a Prometheus collector whose leading labels are the
 * process {@link ConstLabels}; the child bound to those label values is
 * resolved once at construction, so updates go straight to the
 * Prometheus child without a label lookup. A {@link Kind#COUNTER_VEC} adds
 * one trailing bucket label and binds its buckets lazily.
 *
 * <p>Update methods are package-private; callers go through
 * {@link MetricsRegistry}, which checks {@link #kind()} before dispatching.
 * Calling an update for another kind throws {@link IllegalStateException}.
 *
 * <p>Thread-safe.
 */
public final class Metric {

    /**
     * Instrument kinds.
     */
    public enum Kind {
        /** Monotonic scalar. */
        COUNTER,
        /** Counter partitioned by a bucket label, with a {@code total} bucket. */
        COUNTER_VEC,
        /** Instantaneous value that can go up and down. */
        GAUGE,
        /** Bucketed distribution with sum and count. */
        HISTOGRAM
    }

    private final Kind kind;
    private final String name;
    private final ConstLabels labels;

    private final Counter counterVec;
    private final Counter.Child counter;
    private final Gauge.Child gauge;
    private final Histogram.Child histogram;

    private Metric(Kind kind, String name, ConstLabels labels, Counter counterVec,
                   Counter.Child counter, Gauge.Child gauge, Histogram.Child histogram) {
        this.kind = kind;
        this.name = name;
        this.labels = labels;
        this.counterVec = counterVec;
        this.counter = counter;
        this.gauge = gauge;
        this.histogram = histogram;
    }

    /**
     * Wraps a counter declared with {@code labels.names()}.
     */
    public static Metric counter(String name, Counter collector, ConstLabels labels) {
        Objects.requireNonNull(collector, "Counter cannot be null");
        return new Metric(Kind.COUNTER, name, labels, null, collector.labels(labels.values()), null, null);
    }

    /**
     * Wraps a counter declared with {@code labels.namesWith(bucketLabel)}.
     * The {@code total} bucket is bound eagerly so it is exposed from the
     * first scrape.
     */
    public static Metric counterVec(String name, Counter collector, ConstLabels labels) {
        Objects.requireNonNull(collector, "Counter cannot be null");
        Counter.Child total = collector.labels(labels.valuesWith(MetricNames.TOTAL_BUCKET));
        return new Metric(Kind.COUNTER_VEC, name, labels, collector, total, null, null);
    }

    /**
     * Wraps a gauge declared with {@code labels.names()}.
     */
    public static Metric gauge(String name, Gauge collector, ConstLabels labels) {
        Objects.requireNonNull(collector, "Gauge cannot be null");
        return new Metric(Kind.GAUGE, name, labels, null, null, collector.labels(labels.values()), null);
    }

    /**
     * Wraps a histogram declared with {@code labels.names()}.
     */
    public static Metric histogram(String name, Histogram collector, ConstLabels labels) {
        Objects.requireNonNull(collector, "Histogram cannot be null");
        return new Metric(Kind.HISTOGRAM, name, labels, null, null, null, collector.labels(labels.values()));
    }

    public Kind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public ConstLabels labels() {
        return labels;
    }

    // ========================================================================
    // UPDATES
    // ========================================================================

    void incrementCounter(double amount) {
        require(Kind.COUNTER);
        counter.inc(amount);
    }

    void incrementBuckets(String bucket, double amount) {
        require(Kind.COUNTER_VEC);
        counter.inc(amount);
        if (bucket != null) {
            counterVec.labels(labels.valuesWith(bucket)).inc(amount);
        }
    }

    void incrementGauge(double amount) {
        require(Kind.GAUGE);
        gauge.inc(amount);
    }

    void setGauge(double value) {
        require(Kind.GAUGE);
        gauge.set(value);
    }

    void observe(double value) {
        require(Kind.HISTOGRAM);
        histogram.observe(value);
    }

    // ========================================================================
    // READS
    // ========================================================================

    /**
     * Current value of a {@link Kind#COUNTER}.
     */
    public double counterValue() {
        require(Kind.COUNTER);
        return counter.get();
    }

    /**
     * Current value of one bucket of a {@link Kind#COUNTER_VEC}.
     *
     * <p>Reads from a collected snapshot, so asking for a bucket that was
     * never incremented returns 0 without creating it. A {@code null}
     * bucket reads the {@code total} bucket.
     */
    public double bucketValue(String bucket) {
        require(Kind.COUNTER_VEC);
        if (bucket == null) {
            return counter.get();
        }
        for (Collector.MetricFamilySamples family : counterVec.collect()) {
            for (Collector.MetricFamilySamples.Sample sample : family.samples) {
                if (sample.name.equals(family.name + "_total") && matches(sample, bucket)) {
                    return sample.value;
                }
            }
        }
        return 0.0;
    }

    /**
     * Current value of a {@link Kind#GAUGE}.
     */
    public double gaugeValue() {
        require(Kind.GAUGE);
        return gauge.get();
    }

    /**
     * Number of observations recorded by a {@link Kind#HISTOGRAM}.
     */
    public long histogramCount() {
        require(Kind.HISTOGRAM);
        double[] buckets = histogram.get().buckets;
        // Cumulative buckets: the last (+Inf) one holds the total count.
        return (long) buckets[buckets.length - 1];
    }

    /**
     * Sum of the observations recorded by a {@link Kind#HISTOGRAM}.
     */
    public double histogramSum() {
        require(Kind.HISTOGRAM);
        return histogram.get().sum;
    }

    private boolean matches(Collector.MetricFamilySamples.Sample sample, String bucket) {
        List<String> values = sample.labelValues;
        String[] expected = labels.valuesWith(bucket);
        if (values.size() != expected.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (!expected[i].equals(values.get(i))) {
                return false;
            }
        }
        return true;
    }

    private void require(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Metric " + name + " is a " + kind + ", not a " + expected);
        }
    }

    @Override
    public String toString() {
        return "Metric{" + kind + " " + name + "}";
    }
}
