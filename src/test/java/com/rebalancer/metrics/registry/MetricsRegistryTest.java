package com.rebalancer.metrics.registry;

import com.rebalancer.metrics.LogCapture;
import com.rebalancer.metrics.config.MetricsConfig;
import com.rebalancer.metrics.labels.ConstLabels;
import com.rebalancer.metrics.labels.SharedLabels;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Gauge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.*;

class MetricsRegistryTest {

    private CollectorRegistry collectorRegistry;
    private ConstLabels labels;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        SharedLabels sharedLabels = new SharedLabels();
        metrics = new MetricsRegistrar(collectorRegistry, sharedLabels, () -> "test-host")
                .registerAll(MetricsConfig.defaults());
        labels = sharedLabels.get().orElseThrow();
    }

    @Test
    void registerAll_registersWellKnownMetrics() {
        assertThat(metrics.keys()).containsExactlyInAnyOrder(
                MetricNames.REQUEST_COUNT,
                MetricNames.OBJECT_COUNT,
                MetricNames.ERROR_COUNT,
                MetricNames.BYTES_COUNT,
                MetricNames.ASSIGNMENT_TIME);

        assertThat(kind(MetricNames.REQUEST_COUNT)).isEqualTo(Metric.Kind.COUNTER_VEC);
        assertThat(kind(MetricNames.OBJECT_COUNT)).isEqualTo(Metric.Kind.COUNTER_VEC);
        assertThat(kind(MetricNames.ERROR_COUNT)).isEqualTo(Metric.Kind.COUNTER_VEC);
        assertThat(kind(MetricNames.BYTES_COUNT)).isEqualTo(Metric.Kind.COUNTER);
        assertThat(kind(MetricNames.ASSIGNMENT_TIME)).isEqualTo(Metric.Kind.HISTOGRAM);
    }

    @Test
    void registerAll_twiceOnSameCollectorRegistry_fails() {
        MetricsRegistrar again = new MetricsRegistrar(collectorRegistry, new SharedLabels(), () -> "test-host");

        assertThatThrownBy(() -> again.registerAll(MetricsConfig.defaults()))
                .isInstanceOf(MetricsRegistrationException.class)
                .hasMessageContaining(MetricNames.REQUEST_COUNT);
    }

    @Test
    void counterIncBy_accumulatesDeltas() {
        metrics.counterIncBy(MetricNames.BYTES_COUNT, 100);
        metrics.counterIncBy(MetricNames.BYTES_COUNT, 0);
        metrics.counterIncBy(MetricNames.BYTES_COUNT, 23);

        assertThat(metric(MetricNames.BYTES_COUNT).counterValue()).isEqualTo(123.0);
        assertThat(collectorRegistry.getSampleValue("bytes_count_total", labels.names(), labels.values()))
                .isEqualTo(123.0);
    }

    @Test
    void counterVecIncBy_withBucket_incrementsTotalAndBucket() {
        metrics.counterVecIncBy(MetricNames.OBJECT_COUNT, "skipped", 5);
        metrics.counterVecIncBy(MetricNames.OBJECT_COUNT, "assigned", 2);

        Metric objects = metric(MetricNames.OBJECT_COUNT);
        assertThat(objects.bucketValue(MetricNames.TOTAL_BUCKET)).isEqualTo(7.0);
        assertThat(objects.bucketValue("skipped")).isEqualTo(5.0);
        assertThat(objects.bucketValue("assigned")).isEqualTo(2.0);
        assertThat(objects.bucketValue("never_used")).isEqualTo(0.0);

        assertThat(collectorRegistry.getSampleValue("object_count_total",
                labels.namesWith(MetricsRegistrar.OBJECT_LABEL), labels.valuesWith("skipped")))
                .isEqualTo(5.0);
    }

    @Test
    void counterVecInc_withoutBucket_incrementsOnlyTotal() {
        metrics.counterVecInc(MetricNames.REQUEST_COUNT, null);
        metrics.counterVecInc(MetricNames.REQUEST_COUNT, null);

        Metric requests = metric(MetricNames.REQUEST_COUNT);
        assertThat(requests.bucketValue(MetricNames.TOTAL_BUCKET)).isEqualTo(2.0);
        assertThat(bucketSampleCount(MetricNames.REQUEST_COUNT)).isEqualTo(1);
    }

    @Test
    void counterVecInc_bucketsPersistOnceCreated() {
        metrics.counterVecInc(MetricNames.ERROR_COUNT, "timeout");
        metrics.counterVecInc(MetricNames.ERROR_COUNT, null);

        Metric errors = metric(MetricNames.ERROR_COUNT);
        assertThat(errors.bucketValue("timeout")).isEqualTo(1.0);
        assertThat(errors.bucketValue(null)).isEqualTo(2.0);
        assertThat(bucketSampleCount(MetricNames.ERROR_COUNT)).isEqualTo(2);
    }

    @Test
    void histogramObserve_recordsCountAndSum() {
        metrics.histogramObserve(MetricNames.ASSIGNMENT_TIME, 0.5);
        metrics.histogramObserve(MetricNames.ASSIGNMENT_TIME, Duration.ofMillis(1500));

        Metric assignmentTime = metric(MetricNames.ASSIGNMENT_TIME);
        assertThat(assignmentTime.histogramCount()).isEqualTo(2L);
        assertThat(assignmentTime.histogramSum()).isCloseTo(2.0, within(1e-9));
        assertThat(collectorRegistry.getSampleValue("assignment_time_count", labels.names(), labels.values()))
                .isEqualTo(2.0);
    }

    @Test
    void gaugeOperations_adjustAndSetValue() {
        MetricsRegistry withGauge = registryWithGauge("inflight");

        withGauge.gaugeInc("inflight");
        withGauge.gaugeInc("inflight");
        withGauge.gaugeDec("inflight");
        assertThat(gaugeValue(withGauge, "inflight")).isEqualTo(1.0);

        withGauge.gaugeSet("inflight", 42);
        assertThat(gaugeValue(withGauge, "inflight")).isEqualTo(42.0);

        withGauge.gaugeSet("inflight", 7);
        assertThat(gaugeValue(withGauge, "inflight")).isEqualTo(7.0);
    }

    @Test
    void unknownKey_logsOnceAndChangesNothing() {
        metrics.counterIncBy(MetricNames.BYTES_COUNT, 3);
        List<String> before = snapshot();

        try (LogCapture logs = LogCapture.attach(MetricsRegistry.class)) {
            metrics.counterVecInc("no_such_metric", "bucket");

            assertThat(logs.messages(Level.SEVERE))
                    .hasSize(1)
                    .allSatisfy(message -> assertThat(message).contains("no_such_metric"));
        }
        assertThat(snapshot()).isEqualTo(before);
    }

    @Test
    void everyOperation_withUnknownKey_doesNotThrow() {
        try (LogCapture logs = LogCapture.attach(MetricsRegistry.class)) {
            assertThatCode(() -> {
                metrics.gaugeInc("missing");
                metrics.gaugeDec("missing");
                metrics.gaugeSet("missing", 1);
                metrics.counterIncBy("missing", 1);
                metrics.counterVecInc("missing", null);
                metrics.counterVecIncBy("missing", "b", 1);
                metrics.histogramObserve("missing", 1.0);
                metrics.histogramObserve(null, 1.0);
            }).doesNotThrowAnyException();

            assertThat(logs.records(Level.SEVERE)).hasSize(8);
        }
    }

    @Test
    void wrongKind_isIgnoredAndLogged() {
        List<String> before = snapshot();

        try (LogCapture logs = LogCapture.attach(MetricsRegistry.class)) {
            metrics.gaugeInc(MetricNames.REQUEST_COUNT);
            metrics.counterIncBy(MetricNames.ASSIGNMENT_TIME, 4);
            metrics.histogramObserve(MetricNames.BYTES_COUNT, 1.0);

            assertThat(logs.messages(Level.SEVERE))
                    .hasSize(3)
                    .anySatisfy(message -> assertThat(message).contains(MetricNames.REQUEST_COUNT))
                    .anySatisfy(message -> assertThat(message).contains(MetricNames.ASSIGNMENT_TIME))
                    .anySatisfy(message -> assertThat(message).contains(MetricNames.BYTES_COUNT));
        }
        assertThat(snapshot()).isEqualTo(before);
    }

    @Test
    void counterVecInc_reservedTotalBucket_isIgnoredAndLogged() {
        try (LogCapture logs = LogCapture.attach(MetricsRegistry.class)) {
            metrics.counterVecInc(MetricNames.REQUEST_COUNT, MetricNames.TOTAL_BUCKET);
            metrics.counterVecIncBy(MetricNames.OBJECT_COUNT, MetricNames.TOTAL_BUCKET, 3);

            assertThat(logs.messages(Level.SEVERE))
                    .hasSize(2)
                    .allSatisfy(message -> assertThat(message).contains("reserved bucket total"));
        }
        assertThat(metric(MetricNames.REQUEST_COUNT).bucketValue(null)).isEqualTo(0.0);
        assertThat(metric(MetricNames.OBJECT_COUNT).bucketValue(null)).isEqualTo(0.0);

        metrics.counterVecInc(MetricNames.REQUEST_COUNT, "GET");
        assertThat(metric(MetricNames.REQUEST_COUNT).bucketValue(null)).isEqualTo(1.0);
    }

    @Test
    void negativeDelta_isIgnoredAndLogged() {
        try (LogCapture logs = LogCapture.attach(MetricsRegistry.class)) {
            metrics.counterIncBy(MetricNames.BYTES_COUNT, -5);
            metrics.counterVecIncBy(MetricNames.OBJECT_COUNT, "skipped", -1);

            assertThat(logs.records(Level.SEVERE)).hasSize(2);
        }
        assertThat(metric(MetricNames.BYTES_COUNT).counterValue()).isEqualTo(0.0);
        assertThat(metric(MetricNames.OBJECT_COUNT).bucketValue(null)).isEqualTo(0.0);
    }

    @Test
    void concurrentIncrements_allCountedCorrectly() throws Exception {
        int numThreads = 8;
        int incrementsPerThread = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(numThreads);

        for (int i = 0; i < numThreads; i++) {
            final String bucket = i % 2 == 0 ? "even" : "odd";
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < incrementsPerThread; j++) {
                        metrics.counterVecInc(MetricNames.REQUEST_COUNT, bucket);
                        metrics.counterIncBy(MetricNames.BYTES_COUNT, 2);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(endLatch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        Metric requests = metric(MetricNames.REQUEST_COUNT);
        assertThat(requests.bucketValue(MetricNames.TOTAL_BUCKET)).isEqualTo(numThreads * incrementsPerThread);
        assertThat(requests.bucketValue("even")).isEqualTo(numThreads / 2 * incrementsPerThread);
        assertThat(requests.bucketValue("odd")).isEqualTo(numThreads / 2 * incrementsPerThread);
        assertThat(metric(MetricNames.BYTES_COUNT).counterValue()).isEqualTo(2.0 * numThreads * incrementsPerThread);
    }

    private Metric.Kind kind(String key) {
        return metric(key).kind();
    }

    private Metric metric(String key) {
        return metrics.metric(key).orElseThrow();
    }

    private MetricsRegistry registryWithGauge(String name) {
        Gauge gauge = Gauge.build()
                .name(name)
                .help("Test gauge")
                .labelNames(labels.names())
                .register(collectorRegistry);
        return new MetricsRegistry(Map.of(name, Metric.gauge(name, gauge, labels)));
    }

    private static double gaugeValue(MetricsRegistry registry, String key) {
        return registry.metric(key).orElseThrow().gaugeValue();
    }

    private long bucketSampleCount(String family) {
        String sampleName = family + "_total";
        return snapshot().stream().filter(line -> line.startsWith(sampleName + "{")).count();
    }

    /**
     * Every sample except the creation timestamps, as sortable strings.
     */
    private List<String> snapshot() {
        List<String> lines = new ArrayList<>();
        for (Collector.MetricFamilySamples family : Collections.list(collectorRegistry.metricFamilySamples())) {
            for (Collector.MetricFamilySamples.Sample sample : family.samples) {
                if (!sample.name.endsWith("_created")) {
                    lines.add(sample.name + "{" + sample.labelValues + "} " + sample.value);
                }
            }
        }
        Collections.sort(lines);
        return lines;
    }
}
