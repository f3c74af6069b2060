package com.rebalancer.metrics.registry;

import com.rebalancer.metrics.config.MetricsConfig;
import com.rebalancer.metrics.labels.ConstLabels;
import com.rebalancer.metrics.labels.HostnameResolver;
import com.rebalancer.metrics.labels.SharedLabels;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Registers the well-known metrics with Prometheus.
 *
 * <p>Registration:
 * <ol>
 *   <li>Resolves the hostname for the {@code zonename} label ({@code "unknown"} on failure)</li>
 *   <li>Builds the {@link ConstLabels} from the configuration</li>
 *   <li>Registers every {@link MetricNames} metric with the labels</li>
 *   <li>Publishes the labels to {@link SharedLabels} for other instrumentation</li>
 * </ol>
 *
 * <p>Registration is all or nothing. If Prometheus rejects a metric, the ones
 * already registered by this call are unregistered, no labels are published,
 * and {@link MetricsRegistrationException} is thrown. Registering twice
 * against the same {@link CollectorRegistry} fails this way.
 */
public final class MetricsRegistrar {

    private static final Logger logger = Logger.getLogger(MetricsRegistrar.class.getName());

    static final String REQUEST_LABEL = "req";
    static final String OBJECT_LABEL = "type";
    static final String ERROR_LABEL = "error";

    private final CollectorRegistry collectorRegistry;
    private final SharedLabels sharedLabels;
    private final HostnameResolver hostnameResolver;

    /**
     * Creates a registrar targeting the given collector registry and label holder.
     */
    public MetricsRegistrar(CollectorRegistry collectorRegistry,
                            SharedLabels sharedLabels,
                            HostnameResolver hostnameResolver) {
        this.collectorRegistry = Objects.requireNonNull(collectorRegistry, "CollectorRegistry cannot be null");
        this.sharedLabels = Objects.requireNonNull(sharedLabels, "SharedLabels cannot be null");
        this.hostnameResolver = Objects.requireNonNull(hostnameResolver, "HostnameResolver cannot be null");
    }

    /**
     * Registers the well-known metrics in the default Prometheus registry and
     * publishes the labels process-wide.
     *
     * @param config label configuration
     * @return the registry of well-known metrics
     * @throws MetricsRegistrationException if Prometheus rejects a metric
     */
    public static MetricsRegistry register(MetricsConfig config) {
        return new MetricsRegistrar(CollectorRegistry.defaultRegistry, SharedLabels.global(), HostnameResolver.local())
                .registerAll(config);
    }

    /**
     * Registers the well-known metrics.
     *
     * @param config label configuration
     * @return the registry of well-known metrics
     * @throws MetricsRegistrationException if Prometheus rejects a metric
     */
    public MetricsRegistry registerAll(MetricsConfig config) {
        Objects.requireNonNull(config, "MetricsConfig cannot be null");

        // Fleet-wide convention: these labels are the minimum on every metric.
        ConstLabels labels = ConstLabels.of(config, hostnameResolver.resolveOrUnknown());

        List<Collector> registered = new ArrayList<>();
        Map<String, Metric> metrics;
        try {
            metrics = registerWellKnown(labels, registered);
        } catch (MetricsRegistrationException e) {
            registered.forEach(collectorRegistry::unregister);
            logger.severe("Metric registration failed, rolled back " + registered.size() + " collector(s)");
            throw e;
        }

        sharedLabels.publish(labels);
        logger.info("Registered metrics " + metrics.keySet() + " with labels " + labels.asMap());
        return new MetricsRegistry(metrics);
    }

    private Map<String, Metric> registerWellKnown(ConstLabels labels, List<Collector> registered) {
        Map<String, Metric> metrics = new HashMap<>();

        // Requests received, broken down by request type (e.g. req=GET).
        metrics.put(MetricNames.REQUEST_COUNT, Metric.counterVec(MetricNames.REQUEST_COUNT,
                register(Counter.build()
                        .name(MetricNames.REQUEST_COUNT)
                        .help("Total number of requests handled.")
                        .labelNames(labels.namesWith(REQUEST_LABEL)), registered),
                labels));

        // Objects processed, whether successfully or not.
        metrics.put(MetricNames.OBJECT_COUNT, Metric.counterVec(MetricNames.OBJECT_COUNT,
                register(Counter.build()
                        .name(MetricNames.OBJECT_COUNT)
                        .help("Total number of objects processed.")
                        .labelNames(labels.namesWith(OBJECT_LABEL)), registered),
                labels));

        // Errors by kind. Track a bounded set of kinds and fold the rest into
        // a generic bucket, or the series count grows without limit.
        metrics.put(MetricNames.ERROR_COUNT, Metric.counterVec(MetricNames.ERROR_COUNT,
                register(Counter.build()
                        .name(MetricNames.ERROR_COUNT)
                        .help("Errors encountered.")
                        .labelNames(labels.namesWith(ERROR_LABEL)), registered),
                labels));

        metrics.put(MetricNames.BYTES_COUNT, Metric.counter(MetricNames.BYTES_COUNT,
                register(Counter.build()
                        .name(MetricNames.BYTES_COUNT)
                        .help("Bytes transferred.")
                        .labelNames(labels.names()), registered),
                labels));

        metrics.put(MetricNames.ASSIGNMENT_TIME, Metric.histogram(MetricNames.ASSIGNMENT_TIME,
                register(Histogram.build()
                        .name(MetricNames.ASSIGNMENT_TIME)
                        .help("Assignment completion time")
                        .labelNames(labels.names()), registered),
                labels));

        return metrics;
    }

    private Counter register(Counter.Builder builder, List<Collector> registered) {
        try {
            Counter counter = builder.register(collectorRegistry);
            registered.add(counter);
            return counter;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new MetricsRegistrationException("Failed to register counter: " + e.getMessage(), e);
        }
    }

    private Histogram register(Histogram.Builder builder, List<Collector> registered) {
        try {
            Histogram histogram = builder.register(collectorRegistry);
            registered.add(histogram);
            return histogram;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new MetricsRegistrationException("Failed to register histogram: " + e.getMessage(), e);
        }
    }
}
