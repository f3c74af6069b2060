package com.rebalancer.metrics.registry;

import com.rebalancer.metrics.labels.ConstLabels;
import com.rebalancer.metrics.labels.SharedLabels;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.WeakHashMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Instruments created outside the well-known set, carrying the same labels.
 *
 * <p>Subsystems that want their own metrics use this instead of building
 * Prometheus collectors directly, so their series share the
 * {@code service/server/datacenter/zonename} labels published at start-up and
 * show up in the same scrape.
 *
 * <pre>{@code
 * Gauge.Child inflight = AdHocMetrics.global().gauge("inflight_assignments", "Assignments in flight.");
 * inflight.inc();
 * }</pre>
 *
 * <p>Instruments are cached per {@link CollectorRegistry}, not per handle:
 * asking twice for the same name returns the same instrument, also through
 * two different {@code AdHocMetrics} on the same registry. Thread-safe.
 */
public final class AdHocMetrics {

    // Keyed by registry identity; entries go away with their registry.
    private static final Map<CollectorRegistry, Instruments> INSTRUMENTS =
            Collections.synchronizedMap(new WeakHashMap<>());

    private static final AdHocMetrics GLOBAL = new AdHocMetrics();

    private final CollectorRegistry registry;
    private final SharedLabels sharedLabels;
    private final Instruments instruments;

    /**
     * Uses the default Prometheus registry and the process-wide labels.
     */
    public AdHocMetrics() {
        this(CollectorRegistry.defaultRegistry, SharedLabels.global());
    }

    public AdHocMetrics(CollectorRegistry registry, SharedLabels sharedLabels) {
        this.registry = Objects.requireNonNull(registry, "CollectorRegistry cannot be null");
        this.sharedLabels = Objects.requireNonNull(sharedLabels, "SharedLabels cannot be null");
        this.instruments = INSTRUMENTS.computeIfAbsent(registry, r -> new Instruments());
    }

    /**
     * The handle on the default Prometheus registry and the process-wide labels.
     */
    public static AdHocMetrics global() {
        return GLOBAL;
    }

    /**
     * Creates or retrieves a counter.
     *
     * @throws IllegalStateException if no labels were published yet
     * @throws MetricsRegistrationException if the name clashes with another collector
     */
    public Counter.Child counter(String name, String help) {
        ConstLabels labels = labels();
        return instruments.counters.computeIfAbsent(sanitizeName(name), n -> {
            try {
                return Counter.build()
                        .name(n)
                        .help(help)
                        .labelNames(labels.names())
                        .register(registry);
            } catch (IllegalArgumentException e) {
                throw new MetricsRegistrationException("Failed to register counter " + n, e);
            }
        }).labels(labels.values());
    }

    /**
     * Creates or retrieves a gauge.
     *
     * @throws IllegalStateException if no labels were published yet
     * @throws MetricsRegistrationException if the name clashes with another collector
     */
    public Gauge.Child gauge(String name, String help) {
        ConstLabels labels = labels();
        return instruments.gauges.computeIfAbsent(sanitizeName(name), n -> {
            try {
                return Gauge.build()
                        .name(n)
                        .help(help)
                        .labelNames(labels.names())
                        .register(registry);
            } catch (IllegalArgumentException e) {
                throw new MetricsRegistrationException("Failed to register gauge " + n, e);
            }
        }).labels(labels.values());
    }

    /**
     * Creates or retrieves a histogram with the client's default buckets.
     *
     * @throws IllegalStateException if no labels were published yet
     * @throws MetricsRegistrationException if the name clashes with another collector
     */
    public Histogram.Child histogram(String name, String help) {
        ConstLabels labels = labels();
        return instruments.histograms.computeIfAbsent(sanitizeName(name), n -> {
            try {
                return Histogram.build()
                        .name(n)
                        .help(help)
                        .labelNames(labels.names())
                        .register(registry);
            } catch (IllegalArgumentException e) {
                throw new MetricsRegistrationException("Failed to register histogram " + n, e);
            }
        }).labels(labels.values());
    }

    private ConstLabels labels() {
        return sharedLabels.get()
                .orElseThrow(() -> new IllegalStateException("Metric labels have not been published yet"));
    }

    private static final class Instruments {
        final Map<String, Counter> counters = new ConcurrentHashMap<>();
        final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
        final Map<String, Histogram> histograms = new ConcurrentHashMap<>();
    }

    static String sanitizeName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }
}
